package com.example.ldapbridge.controller;

import com.example.ldapbridge.dto.LdapClientSettings;
import com.example.ldapbridge.dto.LdapLoginRequest;
import com.example.ldapbridge.dto.UserInfo;
import com.example.ldapbridge.entity.User;
import com.example.ldapbridge.service.LdapAuthenticationService;
import com.example.ldapbridge.service.LdapClientSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public login surface. Issuing a session for the returned user is left to the
 * host application.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class LdapAuthController {

    private final LdapAuthenticationService ldapAuthenticationService;
    private final LdapClientSettingsService ldapClientSettingsService;

    @GetMapping("/api/ldap/client-settings")
    public ResponseEntity<LdapClientSettings> getClientSettings() {
        return ResponseEntity.ok(ldapClientSettingsService.exportConfig());
    }

    @PostMapping("/api/auth/ldap/login")
    public ResponseEntity<UserInfo> login(@Valid @RequestBody LdapLoginRequest request) {
        log.info("API: POST /api/auth/ldap/login - username='{}'", request.getUsername());
        User user = ldapAuthenticationService.authenticate(request.getUsername(), request.getPassword());
        log.info("LDAP Authentication successful for user: {}", user.getUsername());
        return ResponseEntity.ok(UserInfo.from(user));
    }
}
