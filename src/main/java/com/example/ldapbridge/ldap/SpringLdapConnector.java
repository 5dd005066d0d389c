package com.example.ldapbridge.ldap;

import com.example.ldapbridge.config.LdapBridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.core.support.DefaultTlsDirContextAuthenticationStrategy;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.ldap.core.support.SimpleDirContextAuthenticationStrategy;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import javax.naming.directory.DirContext;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SpringLdapConnector implements LdapConnector {

    static final String JNDI_LDAP_PROVIDER = "com.sun.jndi.ldap.LdapCtxFactory";

    private static final String SOCKET_FACTORY_PROPERTY = "java.naming.ldap.factory.socket";
    private static final String CONNECT_TIMEOUT_PROPERTY = "com.sun.jndi.ldap.connect.timeout";
    private static final String READ_TIMEOUT_PROPERTY = "com.sun.jndi.ldap.read.timeout";

    private final LdapBridgeProperties properties;

    @Override
    public boolean isAvailable() {
        return ClassUtils.isPresent(JNDI_LDAP_PROVIDER, getClass().getClassLoader());
    }

    @Override
    public DirContext open(String serverUrl, String bindDn, String password, TlsPolicy tlsPolicy, BindMode bindMode)
            throws IOException, GeneralSecurityException {
        boolean ldaps = serverUrl.toLowerCase().startsWith("ldaps://");
        SSLSocketFactory sslSocketFactory = (ldaps || bindMode == BindMode.TLS_BEFORE_BIND)
                ? tlsPolicy.createSocketFactory()
                : null;

        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(serverUrl);
        contextSource.setUserDn(bindDn);
        contextSource.setPassword(password);
        contextSource.setPooled(false);

        Map<String, Object> env = new HashMap<>();
        env.put(CONNECT_TIMEOUT_PROPERTY, String.valueOf(properties.getConnectTimeoutMs()));
        env.put(READ_TIMEOUT_PROPERTY, String.valueOf(properties.getReadTimeoutMs()));
        if (ldaps) {
            env.put(SOCKET_FACTORY_PROPERTY, ThreadBoundSSLSocketFactory.class.getName());
        }
        contextSource.setBaseEnvironmentProperties(env);

        if (bindMode == BindMode.TLS_BEFORE_BIND) {
            DefaultTlsDirContextAuthenticationStrategy strategy = new DefaultTlsDirContextAuthenticationStrategy();
            strategy.setSslSocketFactory(sslSocketFactory);
            strategy.setHostnameVerifier(tlsPolicy.hostnameVerifier());
            strategy.setShutdownTlsGracefully(true);
            contextSource.setAuthenticationStrategy(strategy);
        } else {
            contextSource.setAuthenticationStrategy(new SimpleDirContextAuthenticationStrategy());
        }
        contextSource.afterPropertiesSet();

        log.debug("Opening LDAP connection | url: '{}' | bindDn: '{}' | mode: {} | certValidation: {}",
                serverUrl, bindDn, bindMode, tlsPolicy.getValidation());

        if (ldaps) {
            ThreadBoundSSLSocketFactory.bind(sslSocketFactory);
        }
        try {
            return contextSource.getContext(bindDn, password);
        } finally {
            if (ldaps) {
                ThreadBoundSSLSocketFactory.unbind();
            }
        }
    }
}
