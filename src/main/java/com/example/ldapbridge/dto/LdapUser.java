package com.example.ldapbridge.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Local user fields resolved from a directory entry through the configured
 * attribute mapping.
 */
@Data
@Builder
public class LdapUser {
    private String username;
    private String email;
    private String firstName;
    private String lastName;
    private String dn; // Distinguished Name
}
