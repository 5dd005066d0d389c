package com.example.ldapbridge.entity;

/**
 * Whether the directory server's certificate must be validated.
 */
public enum TrustedCert {
    YES,
    NO
}
