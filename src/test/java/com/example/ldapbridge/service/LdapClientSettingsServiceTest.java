package com.example.ldapbridge.service;

import com.example.ldapbridge.config.LdapBridgeProperties;
import com.example.ldapbridge.dto.LdapClientSettings;
import com.example.ldapbridge.entity.LdapSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LdapClientSettingsServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LdapSettingsService settingsService;
    private LdapClientSettingsService clientSettingsService;

    @BeforeEach
    void setUp() {
        settingsService = mock(LdapSettingsService.class);
        clientSettingsService = new LdapClientSettingsService(settingsService, new LdapBridgeProperties());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asJson(LdapClientSettings clientSettings) {
        return objectMapper.convertValue(clientSettings, Map.class);
    }

    @Test
    void noMethodWhenDisabled() {
        when(settingsService.getSettings()).thenReturn(LdapSettings.builder().enabled(false).build());

        LdapClientSettings result = clientSettingsService.exportConfig();

        assertThat(asJson(result)).isEqualTo(Map.of("enabled", false));
    }

    @Test
    void methodSetWhenEnabled() {
        when(settingsService.getSettings()).thenReturn(LdapSettings.builder().enabled(true).build());

        LdapClientSettings result = clientSettingsService.exportConfig();

        assertThat(asJson(result)).isEqualTo(Map.of("enabled", true, "method", "/api/auth/ldap/login"));
    }
}
