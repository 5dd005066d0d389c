package com.example.ldapbridge.ldap;

import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import com.example.ldapbridge.exception.DirectoryUnavailableException;
import com.example.ldapbridge.exception.InvalidCredentialsException;
import com.example.ldapbridge.exception.LdapBridgeException;
import com.example.ldapbridge.exception.LibraryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.AuthenticationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.naming.directory.DirContext;
import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Opens and binds directory connections, collapsing every failure into the
 * bridge's error types.
 */
@Component
@Slf4j
public class LdapConnectionFactory {

    static final String LIBRARY_UNAVAILABLE_MESSAGE =
            "Please install the LDAP client library to use LDAP functionality.";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid Credentials";

    private final LdapConnector connector;
    private final boolean libraryAvailable;

    public LdapConnectionFactory(LdapConnector connector) {
        this.connector = connector;
        this.libraryAvailable = connector.isAvailable();
        if (!libraryAvailable) {
            log.warn("JNDI LDAP provider not found; directory authentication is unavailable");
        }
    }

    /**
     * Binds with the service account stored in {@code settings}.
     */
    public LdapConnection connect(LdapSettings settings) {
        return connect(settings.getServerUrl(), settings.getBaseDn(), settings.getBindPassword(),
                settings.getTlsMode(), settings.getTrustedCert(),
                settings.getCaCertsFile(), settings.getServerCertFile(), settings.getPrivateKeyFile());
    }

    public LdapConnection connect(String serverUrl, String bindDn, String bindPassword, TlsMode tlsMode,
                                  TrustedCert trustedCert, String caCertsFile, String serverCertFile,
                                  String privateKeyFile) {
        if (!libraryAvailable) {
            throw new LibraryUnavailableException(LIBRARY_UNAVAILABLE_MESSAGE);
        }
        if (!StringUtils.hasText(serverUrl)) {
            throw new DirectoryUnavailableException("LDAP server URL is not configured");
        }

        TlsPolicy tlsPolicy = TlsPolicy.of(trustedCert, caCertsFile, serverCertFile, privateKeyFile);
        BindMode bindMode = tlsMode == TlsMode.START_TLS ? BindMode.TLS_BEFORE_BIND : BindMode.DEFAULT;

        try {
            DirContext context = connector.open(serverUrl, bindDn, bindPassword, tlsPolicy, bindMode);
            log.debug("Bound to LDAP server {} as '{}'", serverUrl, bindDn);
            return new LdapConnection(context, serverUrl);
        } catch (AuthenticationException e) {
            log.warn("LDAP bind rejected for '{}' on {}", bindDn, serverUrl);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE, e);
        } catch (LdapBridgeException e) {
            throw e;
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            log.error("LDAP connection to {} failed: {}", serverUrl, e.getMessage());
            throw new DirectoryUnavailableException("LDAP Error: " + e.getMessage(), e);
        }
    }

    /**
     * Verifies a user's own password by binding as that user with the stored TLS
     * settings. The connection is closed straight away.
     */
    public void verifyCredentials(LdapSettings settings, String userDn, String password) {
        if (!StringUtils.hasText(password)) {
            // an empty simple bind is an anonymous bind and would always succeed
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }
        try (LdapConnection ignored = connect(settings.getServerUrl(), userDn, password,
                settings.getTlsMode(), settings.getTrustedCert(),
                settings.getCaCertsFile(), settings.getServerCertFile(), settings.getPrivateKeyFile())) {
            log.debug("Credentials verified for '{}'", userDn);
        }
    }
}
