package com.example.ldapbridge.ldap;

import lombok.extern.slf4j.Slf4j;

import javax.naming.NamingException;
import javax.naming.directory.DirContext;

/**
 * A bound directory connection. Owned by a single call and closed by it.
 */
@Slf4j
public class LdapConnection implements AutoCloseable {

    private final DirContext context;
    private final String serverUrl;

    public LdapConnection(DirContext context, String serverUrl) {
        this.context = context;
        this.serverUrl = serverUrl;
    }

    DirContext getContext() {
        return context;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (NamingException e) {
            log.debug("Error closing LDAP connection to {}: {}", serverUrl, e.getMessage());
        }
    }
}
