package com.example.ldapbridge.ldap;

import javax.naming.directory.DirContext;
import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Opens bound directory contexts. {@link LdapConnectionFactory} owns the policy
 * decisions (TLS, bind mode, error mapping); implementations only carry them out.
 */
public interface LdapConnector {

    /**
     * Whether the directory client runtime is usable in this JVM.
     */
    boolean isAvailable();

    /**
     * Opens a connection to {@code serverUrl} and binds as {@code bindDn}.
     *
     * @throws org.springframework.ldap.AuthenticationException if the directory rejects the credentials
     * @throws org.springframework.ldap.NamingException          for any other directory error
     * @throws IOException                                       if TLS material cannot be read
     * @throws GeneralSecurityException                          if TLS material cannot be used
     */
    DirContext open(String serverUrl, String bindDn, String password, TlsPolicy tlsPolicy, BindMode bindMode)
            throws IOException, GeneralSecurityException;
}
