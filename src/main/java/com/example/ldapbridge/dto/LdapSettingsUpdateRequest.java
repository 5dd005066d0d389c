package com.example.ldapbridge.dto;

import com.example.ldapbridge.entity.TlsMode;
import com.example.ldapbridge.entity.TrustedCert;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

@Data
public class LdapSettingsUpdateRequest {

    // null keeps the stored flag
    private Boolean enabled;

    @Size(max = 512)
    @Pattern(regexp = "^$|^(?i)ldaps?://.+", message = "Server URL must start with ldap:// or ldaps://")
    private String serverUrl;

    @Size(max = 512)
    private String baseDn;

    @Size(max = 512)
    private String organizationalUnit;

    // Blank keeps the stored password
    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @Size(max = 512)
    private String bindPassword;

    @Size(max = 512)
    private String searchTemplate;

    @Size(max = 100)
    private String firstNameField;

    @Size(max = 100)
    private String lastNameField;

    @Size(max = 100)
    private String emailField;

    @Size(max = 100)
    private String usernameField;

    @Size(max = 50)
    private String defaultRole;

    private TrustedCert trustedCert;

    private String caCertsFile;

    private String serverCertFile;

    private String privateKeyFile;

    private TlsMode tlsMode;
}
