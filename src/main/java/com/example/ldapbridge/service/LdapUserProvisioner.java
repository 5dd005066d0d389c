package com.example.ldapbridge.service;

import com.example.ldapbridge.dto.LdapUser;
import com.example.ldapbridge.entity.User;
import com.example.ldapbridge.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates or updates the local user matching a directory entry, keyed by email.
 * Only the mapped fields are written; roles, language and the other host-owned
 * fields of an existing user are left alone.
 */
@Service
@Slf4j
public class LdapUserProvisioner {

    static final String DEFAULT_ROLE = "ROLE_USER";

    private final UserRepository userRepository;
    private final TransactionTemplate transactionTemplate;

    public LdapUserProvisioner(UserRepository userRepository, PlatformTransactionManager transactionManager) {
        this.userRepository = userRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public User upsert(String email, String firstName, String username) {
        return upsert(LdapUser.builder()
                .email(email)
                .firstName(firstName)
                .username(username)
                .build(), null);
    }

    public User upsert(LdapUser ldapUser, String defaultRole) {
        if (!StringUtils.hasText(ldapUser.getEmail())) {
            throw new IllegalArgumentException("Email from LDAP entry cannot be empty");
        }
        String email = normaliseEmail(ldapUser.getEmail());

        Optional<User> existing = userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc(email);
        if (existing.isPresent()) {
            return update(existing.get(), ldapUser);
        }

        try {
            User created = transactionTemplate.execute(status ->
                    userRepository.saveAndFlush(newUser(email, ldapUser, defaultRole)));
            log.info("Created local user for LDAP account: email={}, username={}", email, ldapUser.getUsername());
            return created;
        } catch (DataIntegrityViolationException e) {
            // another login created the same email first
            log.info("User {} was created concurrently; updating instead", email);
            User winner = userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc(email).orElseThrow(() -> e);
            return update(winner, ldapUser);
        }
    }

    private User update(User user, LdapUser ldapUser) {
        boolean changed = false;
        if (!Objects.equals(user.getFirstName(), ldapUser.getFirstName())) {
            user.setFirstName(ldapUser.getFirstName());
            changed = true;
        }
        if (!Objects.equals(user.getUsername(), ldapUser.getUsername())) {
            user.setUsername(ldapUser.getUsername());
            changed = true;
        }
        if (ldapUser.getLastName() != null && !Objects.equals(user.getLastName(), ldapUser.getLastName())) {
            user.setLastName(ldapUser.getLastName());
            changed = true;
        }

        if (!changed) {
            log.debug("Local user {} already matches LDAP entry", user.getEmail());
            return user;
        }

        User saved = transactionTemplate.execute(status -> userRepository.save(user));
        log.info("Updated local user from LDAP entry: email={}, username={}", user.getEmail(), user.getUsername());
        return saved;
    }

    static String normaliseEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private User newUser(String email, LdapUser ldapUser, String defaultRole) {
        return User.builder()
                .email(email)
                .username(ldapUser.getUsername())
                .firstName(ldapUser.getFirstName())
                .lastName(ldapUser.getLastName())
                .authProvider(User.AuthProvider.LDAP)
                .providerId(ldapUser.getDn())
                .sendWelcomeEmail(false)
                .roles(StringUtils.hasText(defaultRole) ? defaultRole.trim() : DEFAULT_ROLE)
                .build();
    }
}
