package com.example.ldapbridge.service;

import com.example.ldapbridge.dto.LdapSettingsDto;
import com.example.ldapbridge.dto.LdapSettingsUpdateRequest;
import com.example.ldapbridge.entity.LdapSettings;
import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import com.example.ldapbridge.repository.LdapSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@RequiredArgsConstructor
@Slf4j
public class LdapSettingsService {

    private final LdapSettingsRepository settingsRepository;
    private final LdapSettingsValidator settingsValidator;

    /**
     * Returns a detached copy of the current settings, creating the disabled
     * default row on first use. Callers read this once per operation.
     */
    @Transactional
    public LdapSettings getSettings() {
        return settingsRepository.findById(LdapSettings.SINGLETON_ID)
                .orElseGet(() -> {
                    log.info("No LDAP settings found; creating disabled defaults");
                    return settingsRepository.save(LdapSettings.builder()
                            .id(LdapSettings.SINGLETON_ID)
                            .enabled(false)
                            .build());
                })
                .snapshot();
    }

    public LdapSettingsDto getSettingsDto() {
        return mapEntityToDto(getSettings());
    }

    /**
     * Validates and then persists {@code settings}. Nothing is written when
     * validation fails.
     */
    public LdapSettings saveSettings(LdapSettings settings) {
        settings.setId(LdapSettings.SINGLETON_ID);
        settingsValidator.validate(settings);
        LdapSettings saved = settingsRepository.save(settings);
        log.info("LDAP settings saved (enabled={}, server={})", saved.isEnabled(), saved.getServerUrl());
        return saved.snapshot();
    }

    public LdapSettingsDto updateSettings(LdapSettingsUpdateRequest request) {
        LdapSettings current = getSettings();
        LdapSettings candidate = applyRequest(current, request);
        return mapEntityToDto(saveSettings(candidate));
    }

    /**
     * Validates the requested settings, including the live bind when enabled,
     * without saving them.
     */
    public void testSettings(LdapSettingsUpdateRequest request) {
        LdapSettings candidate = applyRequest(getSettings(), request);
        candidate.setEnabled(true);
        settingsValidator.validate(candidate);
    }

    private LdapSettings applyRequest(LdapSettings current, LdapSettingsUpdateRequest request) {
        return current.toBuilder()
                .enabled(request.getEnabled() != null ? request.getEnabled() : current.isEnabled())
                .serverUrl(trimToNull(request.getServerUrl()))
                .baseDn(trimToNull(request.getBaseDn()))
                .organizationalUnit(trimToNull(request.getOrganizationalUnit()))
                .bindPassword(StringUtils.hasText(request.getBindPassword())
                        ? request.getBindPassword()
                        : current.getBindPassword())
                .searchTemplate(trimToNull(request.getSearchTemplate()))
                .firstNameField(trimToNull(request.getFirstNameField()))
                .lastNameField(trimToNull(request.getLastNameField()))
                .emailField(trimToNull(request.getEmailField()))
                .usernameField(trimToNull(request.getUsernameField()))
                .defaultRole(trimToNull(request.getDefaultRole()))
                .trustedCert(request.getTrustedCert() != null ? request.getTrustedCert() : TrustedCert.NO)
                .caCertsFile(trimToNull(request.getCaCertsFile()))
                .serverCertFile(trimToNull(request.getServerCertFile()))
                .privateKeyFile(trimToNull(request.getPrivateKeyFile()))
                .tlsMode(request.getTlsMode() != null ? request.getTlsMode() : TlsMode.NONE)
                .build();
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private LdapSettingsDto mapEntityToDto(LdapSettings settings) {
        return LdapSettingsDto.builder()
                .enabled(settings.isEnabled())
                .serverUrl(settings.getServerUrl())
                .baseDn(settings.getBaseDn())
                .organizationalUnit(settings.getOrganizationalUnit())
                .bindPasswordSet(StringUtils.hasText(settings.getBindPassword()))
                .searchTemplate(settings.getSearchTemplate())
                .firstNameField(settings.getFirstNameField())
                .lastNameField(settings.getLastNameField())
                .emailField(settings.getEmailField())
                .usernameField(settings.getUsernameField())
                .defaultRole(settings.getDefaultRole())
                .trustedCert(settings.getTrustedCert())
                .caCertsFile(settings.getCaCertsFile())
                .serverCertFile(settings.getServerCertFile())
                .privateKeyFile(settings.getPrivateKeyFile())
                .tlsMode(settings.getTlsMode())
                .updatedAt(settings.getUpdatedAt())
                .build();
    }
}
