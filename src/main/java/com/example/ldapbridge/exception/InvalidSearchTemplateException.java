package com.example.ldapbridge.exception;

// Raised before persistence; the message tells the administrator the expected form
public class InvalidSearchTemplateException extends LdapBridgeException {
    public InvalidSearchTemplateException(String message) {
        super(message);
    }
}
