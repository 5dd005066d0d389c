package com.example.ldapbridge.exception;

public class UserNotFoundException extends LdapBridgeException {
    public UserNotFoundException(String message) {
        super(message);
    }
}
