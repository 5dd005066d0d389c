package com.example.ldapbridge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Directory connection settings. There is exactly one row per deployment; it is
 * created disabled on first read and never deleted.
 */
@Entity
@Table(name = "ldap_settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LdapSettings {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false)
    private boolean enabled;

    @Column(length = 512)
    private String serverUrl; // e.g., ldap://192.168.1.100:389

    // DN of the service account the bridge binds as
    @Column(length = 512)
    private String baseDn;

    @Column(length = 512)
    private String organizationalUnit; // e.g., ou=users,dc=example,dc=com

    @ToString.Exclude
    @Column(length = 512)
    private String bindPassword;

    @Column(length = 512)
    private String searchTemplate; // e.g., sAMAccountName={0}

    // --- Attribute mapping ---
    @Column(length = 100)
    private String firstNameField;

    @Column(length = 100)
    private String lastNameField;

    @Column(length = 100)
    private String emailField;

    @Column(length = 100)
    private String usernameField;

    @Column(length = 50)
    private String defaultRole;

    // --- TLS ---
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private TrustedCert trustedCert = TrustedCert.NO;

    @Column(length = 1024)
    private String caCertsFile;

    @Column(length = 1024)
    private String serverCertFile;

    @Column(length = 1024)
    private String privateKeyFile;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TlsMode tlsMode = TlsMode.NONE;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Detached copy used for the duration of one call so that a concurrent
     * settings update cannot change values mid-operation.
     */
    public LdapSettings snapshot() {
        return toBuilder().build();
    }
}
