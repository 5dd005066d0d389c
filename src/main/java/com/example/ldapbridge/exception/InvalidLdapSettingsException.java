package com.example.ldapbridge.exception;

public class InvalidLdapSettingsException extends LdapBridgeException {
    public InvalidLdapSettingsException(String message) {
        super(message);
    }
}
