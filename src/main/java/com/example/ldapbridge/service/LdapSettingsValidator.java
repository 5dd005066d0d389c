package com.example.ldapbridge.service;

import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.exception.InvalidLdapSettingsException;
import com.example.ldapbridge.exception.InvalidSearchTemplateException;
import com.example.ldapbridge.ldap.LdapConnection;
import com.example.ldapbridge.ldap.LdapConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks directory settings before they are persisted. Enabling the bridge
 * requires a live bind; whatever the bind throws reaches the caller unchanged,
 * so broken settings are never stored as enabled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LdapSettingsValidator {

    static final String INVALID_SEARCH_TEMPLATE_MESSAGE =
            "LDAP Search String needs to end with a placeholder, eg sAMAccountName={0}";

    // attr={0}, optionally closing any enclosing filter parentheses
    private static final Pattern TRAILING_PLACEHOLDER = Pattern.compile(".*=\\{0\\}\\)*");
    private static final String PLACEHOLDER = "{0}";

    private final LdapConnectionFactory connectionFactory;

    public void validate(LdapSettings settings) {
        String searchTemplate = settings.getSearchTemplate();
        if (StringUtils.hasText(searchTemplate) || settings.isEnabled()) {
            validateSearchTemplate(searchTemplate);
        }

        if (!settings.isEnabled()) {
            return;
        }

        validateRequiredFields(settings);

        log.info("Testing LDAP connection to {} before enabling", settings.getServerUrl());
        try (LdapConnection ignored = connectionFactory.connect(settings)) {
            log.info("LDAP connection test succeeded for {}", settings.getServerUrl());
        }
    }

    static void validateSearchTemplate(String searchTemplate) {
        if (!StringUtils.hasText(searchTemplate)
                || !TRAILING_PLACEHOLDER.matcher(searchTemplate.trim()).matches()) {
            throw new InvalidSearchTemplateException(INVALID_SEARCH_TEMPLATE_MESSAGE);
        }
        // {0} is the only brace sequence the searcher substitutes
        String remainder = searchTemplate.replace(PLACEHOLDER, "");
        if (remainder.indexOf('{') >= 0 || remainder.indexOf('}') >= 0) {
            throw new InvalidSearchTemplateException(INVALID_SEARCH_TEMPLATE_MESSAGE);
        }
    }

    private void validateRequiredFields(LdapSettings settings) {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(settings.getServerUrl())) missing.add("serverUrl");
        if (!StringUtils.hasText(settings.getFirstNameField())) missing.add("firstNameField");
        if (!StringUtils.hasText(settings.getEmailField())) missing.add("emailField");
        if (!StringUtils.hasText(settings.getUsernameField())) missing.add("usernameField");
        if (!missing.isEmpty()) {
            throw new InvalidLdapSettingsException("Required LDAP settings missing: " + String.join(", ", missing));
        }
    }
}
