package com.example.ldapbridge.security;

import com.example.ldapbridge.entity.User;
import com.example.ldapbridge.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Local credential store lookup. Users provisioned from the directory carry no
 * local password and are refused here; they sign in through the LDAP endpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String usernameOrEmail) throws UsernameNotFoundException {
        User user = userRepository.findFirstByUsernameIgnoreCase(usernameOrEmail)
                .or(() -> userRepository.findFirstByEmailIgnoreCaseOrderByIdAsc(usernameOrEmail))
                .orElseThrow(() -> {
                    log.warn("Login Failed: User '{}' not found", usernameOrEmail);
                    return new UsernameNotFoundException("User not found with username or email: " + usernameOrEmail);
                });

        if (!StringUtils.hasText(user.getPassword())) {
            log.warn("Local login refused for '{}': account has no local password", usernameOrEmail);
            throw new UsernameNotFoundException("No local password for user: " + usernameOrEmail);
        }

        return new org.springframework.security.core.userdetails.User(
                user.getUsername() != null ? user.getUsername() : user.getEmail(),
                user.getPassword(),
                user.isEnabled(),
                true,
                true,
                user.isAccountNonLocked(),
                user.getAuthorities()
        );
    }
}
