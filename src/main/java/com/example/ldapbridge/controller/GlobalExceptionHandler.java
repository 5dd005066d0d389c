package com.example.ldapbridge.controller;

import com.example.ldapbridge.dto.ErrorResponse;
import com.example.ldapbridge.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Maps bridge failures onto HTTP responses. Unknown users and rejected
 * credentials share a status but keep distinct codes so operators can tell
 * them apart in logs and responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidSearchTemplateException.class, InvalidLdapSettingsException.class,
            BridgeDisabledException.class})
    public ResponseEntity<ErrorResponse> handleValidation(LdapBridgeException e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, e, request);
    }

    @ExceptionHandler({InvalidCredentialsException.class, UserNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleAuthenticationFailure(LdapBridgeException e, HttpServletRequest request) {
        return build(HttpStatus.UNAUTHORIZED, e, request);
    }

    @ExceptionHandler({DirectoryUnavailableException.class, LibraryUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(LdapBridgeException e, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, e, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now().toString())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .code("InvalidRequest")
                .message(message)
                .path(request.getRequestURI())
                .build());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, LdapBridgeException e, HttpServletRequest request) {
        log.warn("{} on {}: {}", e.getClass().getSimpleName(), request.getRequestURI(), e.getMessage());
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now().toString())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(e.getClass().getSimpleName().replace("Exception", ""))
                .message(e.getMessage())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
