package com.example.ldapbridge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What the login page needs to know: whether directory login is offered and,
 * if so, where to post credentials. {@code method} is absent when disabled.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LdapClientSettings {

    private boolean enabled;

    private String method;

    public static LdapClientSettings disabled() {
        return new LdapClientSettings(false, null);
    }

    public static LdapClientSettings enabled(String method) {
        return new LdapClientSettings(true, method);
    }
}
