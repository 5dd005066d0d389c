package com.example.ldapbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ldap.bridge")
public class LdapBridgeProperties {

    /**
     * Milliseconds allowed for opening the TCP connection to the directory.
     */
    private int connectTimeoutMs = 5000;

    /**
     * Milliseconds to wait for a directory response before giving up.
     */
    private int readTimeoutMs = 10000;

    /**
     * Login entry point reported to the UI when directory login is enabled.
     */
    private String loginMethod = "/api/auth/ldap/login";
}
