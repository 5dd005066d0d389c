package com.example.ldapbridge.ldap;

public enum BindMode {
    /** Bind on the connection as opened (plain for ldap://, TLS for ldaps://). */
    DEFAULT,
    /** Negotiate StartTLS on the plain connection, then bind over TLS. */
    TLS_BEFORE_BIND
}
