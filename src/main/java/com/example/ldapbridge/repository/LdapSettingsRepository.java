package com.example.ldapbridge.repository;

import com.example.ldapbridge.entity.LdapSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LdapSettingsRepository extends JpaRepository<LdapSettings, Long> {
}
