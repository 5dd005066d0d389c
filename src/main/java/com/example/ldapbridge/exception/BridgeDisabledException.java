package com.example.ldapbridge.exception;

public class BridgeDisabledException extends LdapBridgeException {
    public BridgeDisabledException(String message) {
        super(message);
    }
}
