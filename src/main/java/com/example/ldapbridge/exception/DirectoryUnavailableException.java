package com.example.ldapbridge.exception;

/**
 * The directory could not be reached or answered with a protocol error other than
 * rejected credentials. The underlying error is kept as the cause.
 */
public class DirectoryUnavailableException extends LdapBridgeException {
    public DirectoryUnavailableException(String message) {
        super(message);
    }

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
