package com.example.ldapbridge.exception;

/**
 * Base type for every failure raised by the directory bridge.
 */
public class LdapBridgeException extends RuntimeException {
    public LdapBridgeException(String message) {
        super(message);
    }

    public LdapBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
