package com.example.ldapbridge.service;

import com.example.ldapbridge.dto.LdapUser;
import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.entity.User;
import com.example.ldapbridge.exception.BridgeDisabledException;
import com.example.ldapbridge.exception.UserNotFoundException;
import com.example.ldapbridge.ldap.DirectoryEntry;
import com.example.ldapbridge.ldap.LdapConnection;
import com.example.ldapbridge.ldap.LdapConnectionFactory;
import com.example.ldapbridge.ldap.LdapDirectorySearcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Login-time entry point of the bridge. Each call reads the settings once, opens
 * its own connection, looks the user up, verifies the password with a bind as
 * the found entry and provisions the local user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LdapAuthenticationService {

    static final String NOT_ENABLED_MESSAGE = "LDAP is not enabled.";
    static final String NOT_A_VALID_USER_MESSAGE = "Not a valid LDAP user";

    private final LdapSettingsService settingsService;
    private final LdapConnectionFactory connectionFactory;
    private final LdapDirectorySearcher directorySearcher;
    private final LdapUserProvisioner userProvisioner;

    public User authenticate(String username, String password) {
        LdapSettings settings = settingsService.getSettings();
        if (!settings.isEnabled()) {
            throw new BridgeDisabledException(NOT_ENABLED_MESSAGE);
        }
        if (!StringUtils.hasText(username)) {
            throw new UserNotFoundException(NOT_A_VALID_USER_MESSAGE);
        }

        DirectoryEntry entry;
        try (LdapConnection connection = connectionFactory.connect(settings)) {
            List<DirectoryEntry> entries = directorySearcher.search(connection,
                    settings.getSearchTemplate(),
                    settings.getOrganizationalUnit(),
                    settings.getBaseDn(),
                    username,
                    mappedAttributes(settings));

            if (entries.isEmpty()) {
                log.warn("User '{}' not found in directory", username);
                throw new UserNotFoundException(NOT_A_VALID_USER_MESSAGE);
            }
            if (entries.size() > 1) {
                log.warn("{} directory entries match '{}'; using the first", entries.size(), username);
            }
            entry = entries.get(0);
        }
        log.info("User found: {}", entry.getDn());

        connectionFactory.verifyCredentials(settings, entry.getDn(), password);
        log.info("User credentials verified successfully for: {}", entry.getDn());

        LdapUser ldapUser = mapEntry(entry, settings, username);
        if (!StringUtils.hasText(ldapUser.getEmail())) {
            log.warn("Directory entry {} has no value for email attribute '{}'", entry.getDn(), settings.getEmailField());
            throw new UserNotFoundException("LDAP user has no email address");
        }
        return userProvisioner.upsert(ldapUser, settings.getDefaultRole());
    }

    private List<String> mappedAttributes(LdapSettings settings) {
        List<String> attributes = new ArrayList<>();
        attributes.add(settings.getEmailField());
        attributes.add(settings.getUsernameField());
        attributes.add(settings.getFirstNameField());
        if (StringUtils.hasText(settings.getLastNameField())) {
            attributes.add(settings.getLastNameField());
        }
        return attributes;
    }

    private LdapUser mapEntry(DirectoryEntry entry, LdapSettings settings, String loginName) {
        String username = entry.getAttribute(settings.getUsernameField());
        return LdapUser.builder()
                .email(entry.getAttribute(settings.getEmailField()))
                .firstName(entry.getAttribute(settings.getFirstNameField()))
                .lastName(StringUtils.hasText(settings.getLastNameField())
                        ? entry.getAttribute(settings.getLastNameField())
                        : null)
                .username(StringUtils.hasText(username) ? username : loginName)
                .dn(entry.getDn())
                .build();
    }
}
