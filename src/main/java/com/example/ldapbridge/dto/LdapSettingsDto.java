package com.example.ldapbridge.dto;

import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Read view of the directory settings. The bind password is never exposed;
 * {@code bindPasswordSet} tells the admin UI whether one is stored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LdapSettingsDto {
    private boolean enabled;
    private String serverUrl;
    private String baseDn;
    private String organizationalUnit;
    private boolean bindPasswordSet;
    private String searchTemplate;
    private String firstNameField;
    private String lastNameField;
    private String emailField;
    private String usernameField;
    private String defaultRole;
    private TrustedCert trustedCert;
    private String caCertsFile;
    private String serverCertFile;
    private String privateKeyFile;
    private TlsMode tlsMode;
    private LocalDateTime updatedAt;
}
