package com.example.ldapbridge.service;

import com.example.ldapbridge.config.LdapBridgeProperties;
import com.example.ldapbridge.dto.LdapClientSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LdapClientSettingsService {

    private final LdapSettingsService settingsService;
    private final LdapBridgeProperties properties;

    public LdapClientSettings exportConfig() {
        if (!settingsService.getSettings().isEnabled()) {
            return LdapClientSettings.disabled();
        }
        return LdapClientSettings.enabled(properties.getLoginMethod());
    }
}
