package com.example.ldapbridge.controller;

import com.example.ldapbridge.dto.ApiResponse;
import com.example.ldapbridge.dto.LdapSettingsDto;
import com.example.ldapbridge.dto.LdapSettingsUpdateRequest;
import com.example.ldapbridge.exception.LdapBridgeException;
import com.example.ldapbridge.service.LdapSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/ldap-settings")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Slf4j
public class LdapSettingsController {

    private final LdapSettingsService ldapSettingsService;

    @GetMapping
    public ResponseEntity<LdapSettingsDto> getLdapSettings() {
        log.info("API: GET /api/admin/ldap-settings");
        return ResponseEntity.ok(ldapSettingsService.getSettingsDto());
    }

    @PutMapping
    public ResponseEntity<LdapSettingsDto> updateLdapSettings(@Valid @RequestBody LdapSettingsUpdateRequest updateRequest) {
        log.info("API: PUT /api/admin/ldap-settings - enabled={}, serverUrl='{}'",
                updateRequest.getEnabled(), updateRequest.getServerUrl());
        return ResponseEntity.ok(ldapSettingsService.updateSettings(updateRequest));
    }

    @PostMapping("/test-connection")
    public ResponseEntity<ApiResponse> testLdapConnection(@Valid @RequestBody LdapSettingsUpdateRequest testRequest) {
        log.info("API: POST /api/admin/ldap-settings/test-connection - serverUrl='{}'", testRequest.getServerUrl());
        try {
            ldapSettingsService.testSettings(testRequest);
            return ResponseEntity.ok(ApiResponse.builder()
                    .success(true)
                    .message("Successfully connected and bound to LDAP server.")
                    .build());
        } catch (LdapBridgeException e) {
            log.warn("LDAP Test Failed: {}", e.getMessage());
            return ResponseEntity.ok(ApiResponse.builder()
                    .success(false)
                    .message("Connection Failed: " + e.getMessage())
                    .build());
        }
    }
}
