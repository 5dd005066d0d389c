package com.example.ldapbridge.ldap;

import com.example.ldapbridge.InMemoryDirectory;
import com.example.ldapbridge.config.LdapBridgeProperties;
import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import com.example.ldapbridge.exception.DirectoryUnavailableException;
import com.example.ldapbridge.exception.InvalidCredentialsException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Real JNDI connections over StartTLS and LDAPS against a directory presenting a
 * self-signed certificate.
 */
class SpringLdapConnectorTlsTest {

    private static InMemoryDirectory directory;

    private LdapConnectionFactory connectionFactory;
    private LdapDirectorySearcher directorySearcher;

    @BeforeAll
    static void startDirectory() throws Exception {
        directory = InMemoryDirectory.startWithTls();
    }

    @AfterAll
    static void stopDirectory() {
        directory.stop();
    }

    @BeforeEach
    void setUp() {
        LdapBridgeProperties properties = new LdapBridgeProperties();
        properties.setConnectTimeoutMs(2000);
        properties.setReadTimeoutMs(5000);
        connectionFactory = new LdapConnectionFactory(new SpringLdapConnector(properties));
        directorySearcher = new LdapDirectorySearcher();
    }

    private static LdapSettings settings(String serverUrl, TlsMode tlsMode, TrustedCert trustedCert) {
        return LdapSettings.builder()
                .enabled(true)
                .serverUrl(serverUrl)
                .baseDn(InMemoryDirectory.ADMIN_DN)
                .bindPassword(InMemoryDirectory.ADMIN_PASSWORD)
                .organizationalUnit(InMemoryDirectory.PEOPLE)
                .searchTemplate("uid={0}")
                .tlsMode(tlsMode)
                .trustedCert(trustedCert)
                .build();
    }

    private List<DirectoryEntry> findBill(LdapConnection connection) {
        return directorySearcher.search(connection, "uid={0}", InMemoryDirectory.PEOPLE, null, "bill",
                List.of("mail"));
    }

    @Test
    void startTlsWithoutCertificateValidationBindsAndSearches() {
        LdapSettings settings = settings(directory.startTlsUrl(), TlsMode.START_TLS, TrustedCert.NO);

        try (LdapConnection connection = connectionFactory.connect(settings)) {
            List<DirectoryEntry> entries = findBill(connection);

            assertThat(entries).hasSize(1);
            assertThat(entries.get(0).getAttribute("mail")).isEqualTo("billy@test.com");
        }
    }

    @Test
    void startTlsVerifiesUserPassword() {
        LdapSettings settings = settings(directory.startTlsUrl(), TlsMode.START_TLS, TrustedCert.NO);
        String billDn = "uid=bill," + InMemoryDirectory.PEOPLE;

        connectionFactory.verifyCredentials(settings, billDn, InMemoryDirectory.BILL_PASSWORD);

        assertThatThrownBy(() -> connectionFactory.verifyCredentials(settings, billDn, "wrong"))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void startTlsRejectsUntrustedCertificateWhenValidating() {
        LdapSettings settings = settings(directory.startTlsUrl(), TlsMode.START_TLS, TrustedCert.YES);

        assertThatThrownBy(() -> connectionFactory.connect(settings))
                .isInstanceOf(DirectoryUnavailableException.class);
    }

    @Test
    void ldapsWithoutCertificateValidationBindsAndSearches() {
        LdapSettings settings = settings(directory.ldapsUrl(), TlsMode.NONE, TrustedCert.NO);

        try (LdapConnection connection = connectionFactory.connect(settings)) {
            assertThat(findBill(connection)).hasSize(1);
        }
    }

    @Test
    void ldapsRejectsUntrustedCertificateWhenValidating() {
        LdapSettings settings = settings(directory.ldapsUrl(), TlsMode.NONE, TrustedCert.YES);

        assertThatThrownBy(() -> connectionFactory.connect(settings))
                .isInstanceOf(DirectoryUnavailableException.class);
    }

    @Test
    void ldapsStillBindsAfterAValidatingAttemptFailed() {
        LdapSettings validating = settings(directory.ldapsUrl(), TlsMode.NONE, TrustedCert.YES);
        LdapSettings trustAll = settings(directory.ldapsUrl(), TlsMode.NONE, TrustedCert.NO);

        assertThatThrownBy(() -> connectionFactory.connect(validating))
                .isInstanceOf(DirectoryUnavailableException.class);
        try (LdapConnection connection = connectionFactory.connect(trustAll)) {
            assertThat(connection.getServerUrl()).isEqualTo(directory.ldapsUrl());
        }
    }

    @Test
    void plainListenerIsUnaffectedByTrustSetting() {
        LdapSettings settings = settings(directory.url(), TlsMode.NONE, TrustedCert.YES);

        try (LdapConnection connection = connectionFactory.connect(settings)) {
            assertThat(findBill(connection)).hasSize(1);
        }
    }
}
