package com.example.ldapbridge;

import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import com.example.ldapbridge.entity.User;
import com.example.ldapbridge.exception.DirectoryUnavailableException;
import com.example.ldapbridge.exception.InvalidCredentialsException;
import com.example.ldapbridge.exception.InvalidSearchTemplateException;
import com.example.ldapbridge.exception.UserNotFoundException;
import com.example.ldapbridge.ldap.DirectoryEntry;
import com.example.ldapbridge.ldap.LdapConnection;
import com.example.ldapbridge.ldap.LdapConnectionFactory;
import com.example.ldapbridge.ldap.LdapDirectorySearcher;
import com.example.ldapbridge.repository.UserRepository;
import com.example.ldapbridge.service.LdapAuthenticationService;
import com.example.ldapbridge.service.LdapSettingsService;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Full login flow against an embedded directory over real JNDI connections.
 */
@SpringBootTest
class LdapBridgeIntegrationTest {

    private static InMemoryDirectory directory;

    @Autowired
    private LdapSettingsService settingsService;

    @Autowired
    private LdapAuthenticationService authenticationService;

    @Autowired
    private LdapConnectionFactory connectionFactory;

    @Autowired
    private LdapDirectorySearcher directorySearcher;

    @Autowired
    private UserRepository userRepository;

    @BeforeAll
    static void startDirectory() throws Exception {
        directory = InMemoryDirectory.start();
    }

    @AfterAll
    static void stopDirectory() {
        directory.stop();
    }

    @BeforeEach
    void setUp() {
        userRepository.deleteAll();
        settingsService.saveSettings(enabledSettings());
    }

    private static LdapSettings enabledSettings() {
        return LdapSettings.builder()
                .enabled(true)
                .serverUrl(directory.url())
                .baseDn(InMemoryDirectory.ADMIN_DN)
                .bindPassword(InMemoryDirectory.ADMIN_PASSWORD)
                .organizationalUnit(InMemoryDirectory.PEOPLE)
                .searchTemplate("uid={0}")
                .firstNameField("givenName")
                .lastNameField("sn")
                .emailField("mail")
                .usernameField("uid")
                .trustedCert(TrustedCert.NO)
                .tlsMode(TlsMode.NONE)
                .build();
    }

    @Test
    void authenticateCreatesLocalUserFromDirectoryEntry() {
        assertThat(userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc("billy@test.com")).isEmpty();

        User user = authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);

        assertThat(userRepository.count()).isEqualTo(1);
        User stored = userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc("billy@test.com").orElseThrow();
        assertThat(stored.getId()).isEqualTo(user.getId());
        assertThat(stored.getFirstName()).isEqualTo("Billy");
        assertThat(stored.getLastName()).isEqualTo("Bob");
        assertThat(stored.getUsername()).isEqualTo("bill");
        assertThat(stored.getAuthProvider()).isEqualTo(User.AuthProvider.LDAP);
        assertThat(stored.getProviderId()).isEqualToIgnoringCase("uid=bill," + InMemoryDirectory.PEOPLE);
    }

    @Test
    void authenticateUpdatesExistingUserAndKeepsHostFields() {
        userRepository.save(User.builder()
                .email("billy@test.com")
                .firstName("JIM")
                .username("JIMMY")
                .roles("ROLE_BLOGGER")
                .language("de")
                .build());

        authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);

        assertThat(userRepository.count()).isEqualTo(1);
        User stored = userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc("billy@test.com").orElseThrow();
        assertThat(stored.getFirstName()).isEqualTo("Billy");
        assertThat(stored.getUsername()).isEqualTo("bill");
        assertThat(stored.getRoles()).isEqualTo("ROLE_BLOGGER");
        assertThat(stored.getLanguage()).isEqualTo("de");
        assertThat(stored.getAuthProvider()).isEqualTo(User.AuthProvider.LOCAL);
    }

    @Test
    void existingUserWithDifferentlyCasedEmailIsUpdatedNotDuplicated() {
        User existing = userRepository.save(User.builder()
                .email("Billy@Test.com")
                .firstName("JIM")
                .username("JIMMY")
                .build());

        User user = authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);

        assertThat(userRepository.count()).isEqualTo(1);
        assertThat(user.getId()).isEqualTo(existing.getId());
        assertThat(user.getEmail()).isEqualTo("Billy@Test.com");
        assertThat(user.getFirstName()).isEqualTo("Billy");
    }

    @Test
    void repeatedAuthenticationIsIdempotent() {
        User first = authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);
        User second = authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);

        assertThat(userRepository.count()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getEmail()).isEqualTo(first.getEmail());
    }

    @Test
    void unknownUserIsNotAValidLdapUser() {
        assertThatThrownBy(() -> authenticationService.authenticate("nobody", "whatever"))
                .isInstanceOf(UserNotFoundException.class)
                .hasMessage("Not a valid LDAP user");
        assertThat(userRepository.count()).isZero();
    }

    @Test
    void wrongPasswordIsRejected() {
        assertThatThrownBy(() -> authenticationService.authenticate("bill", "not-bills-password"))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThat(userRepository.count()).isZero();
    }

    @Test
    void emptyPasswordIsRejected() {
        assertThatThrownBy(() -> authenticationService.authenticate("bill", ""))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void entryWithoutMailIsRejected() {
        assertThatThrownBy(() -> authenticationService.authenticate("nomail", "nomail-secret"))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void filterMetacharactersInUsernameAreEscaped() {
        assertThatThrownBy(() -> authenticationService.authenticate("*", "whatever"))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void searchReturnsRequestedAttributesInOrder() {
        try (LdapConnection connection = connectionFactory.connect(settingsService.getSettings())) {
            List<DirectoryEntry> entries = directorySearcher.search(connection, "(&(objectClass=person)(uid={0}))",
                    InMemoryDirectory.PEOPLE, null, "bill", List.of("mail", "givenName"));

            assertThat(entries).hasSize(1);
            assertThat(entries.get(0).getAttributes()).containsExactly(
                    entry("mail", "billy@test.com"),
                    entry("givenName", "Billy"));
        }
    }

    @Test
    void templateWithStrayBracesIsNeverStoredAndLoginKeepsWorking() {
        LdapSettings braces = enabledSettings();
        braces.setSearchTemplate("(&(!(description={x}))(uid={0}))");

        assertThatThrownBy(() -> settingsService.saveSettings(braces))
                .isInstanceOf(InvalidSearchTemplateException.class);

        assertThat(settingsService.getSettings().getSearchTemplate()).isEqualTo("uid={0}");
        assertThat(authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD).getEmail())
                .isEqualTo("billy@test.com");
    }

    @Test
    void compoundTemplateWithQuotesFindsUser() {
        LdapSettings settings = enabledSettings();
        settings.setSearchTemplate("(&(!(cn=o'brien))(objectClass=inetOrgPerson)(uid={0}))");
        settingsService.saveSettings(settings);

        User user = authenticationService.authenticate("bill", InMemoryDirectory.BILL_PASSWORD);

        assertThat(user.getFirstName()).isEqualTo("Billy");
    }

    @Test
    void wrongServiceAccountPasswordIsInvalidCredentials() {
        LdapSettings settings = enabledSettings();
        settings.setBindPassword("wrong");

        assertThatThrownBy(() -> connectionFactory.connect(settings))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid Credentials");
    }

    @Test
    void unreachableServerIsDirectoryUnavailable() {
        LdapSettings settings = enabledSettings();
        settings.setServerUrl("ldap://127.0.0.1:1");

        assertThatThrownBy(() -> connectionFactory.connect(settings))
                .isInstanceOf(DirectoryUnavailableException.class)
                .satisfies(e -> assertThat(e.getCause()).isNotNull());
    }

    @Test
    void enablingWithBrokenSettingsLeavesStoredSettingsUntouched() {
        LdapSettings broken = enabledSettings();
        broken.setServerUrl("ldap://127.0.0.1:1");

        assertThatThrownBy(() -> settingsService.saveSettings(broken))
                .isInstanceOf(DirectoryUnavailableException.class);

        assertThat(settingsService.getSettings().getServerUrl()).isEqualTo(directory.url());
    }
}
