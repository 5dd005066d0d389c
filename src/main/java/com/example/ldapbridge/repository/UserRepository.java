package com.example.ldapbridge.repository;

import com.example.ldapbridge.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import jakarta.persistence.QueryHint;
import java.util.Optional;

/**
 * Local user store. The unique constraint on {@code email} is what makes a
 * concurrent first-time provisioning safe: the losing insert fails and the
 * caller falls back to an update.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    // email addresses compare case-insensitively; rows stored before normalisation may be mixed-case
    @QueryHints(@QueryHint(name = "jakarta.persistence.cache.retrieveMode", value = "BYPASS"))
    Optional<User> findFirstByEmailIgnoreCaseOrderByIdAsc(String email);

    Optional<User> findFirstByUsernameIgnoreCase(String username);
}
