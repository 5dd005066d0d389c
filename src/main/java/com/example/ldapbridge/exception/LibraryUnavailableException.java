package com.example.ldapbridge.exception;

public class LibraryUnavailableException extends LdapBridgeException {
    public LibraryUnavailableException(String message) {
        super(message);
    }
}
