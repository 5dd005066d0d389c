package com.example.ldapbridge.entity;

public enum TlsMode {
    NONE,
    START_TLS
}
