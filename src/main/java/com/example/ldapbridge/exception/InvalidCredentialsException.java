package com.example.ldapbridge.exception;

public class InvalidCredentialsException extends LdapBridgeException {
    public InvalidCredentialsException(String message) {
        super(message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
