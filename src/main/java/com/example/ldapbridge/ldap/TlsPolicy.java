package com.example.ldapbridge.ldap;

import com.example.ldapbridge.entity.TrustedCert;
import com.example.ldapbridge.util.CertificateUtils;
import lombok.Builder;
import lombok.Value;
import org.springframework.util.StringUtils;

import javax.net.ssl.*;
import java.io.IOException;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * TLS settings for one directory connection. Certificate files are only read
 * when a socket factory is actually needed.
 */
@Value
@Builder
public class TlsPolicy {

    private static final char[] IN_MEMORY_STORE_PASSWORD = "ldap-bridge".toCharArray();

    CertValidation validation;
    String caCertsFile;
    String certificateFile;
    String privateKeyFile;

    public enum CertValidation {
        REQUIRED,
        NONE
    }

    public static TlsPolicy of(TrustedCert trustedCert, String caCertsFile, String certificateFile, String privateKeyFile) {
        if (trustedCert != TrustedCert.YES) {
            return TlsPolicy.builder().validation(CertValidation.NONE).build();
        }
        return TlsPolicy.builder()
                .validation(CertValidation.REQUIRED)
                .caCertsFile(StringUtils.hasText(caCertsFile) ? caCertsFile : null)
                .certificateFile(StringUtils.hasText(certificateFile) ? certificateFile : null)
                .privateKeyFile(StringUtils.hasText(privateKeyFile) ? privateKeyFile : null)
                .build();
    }

    public boolean isValidating() {
        return validation == CertValidation.REQUIRED;
    }

    public HostnameVerifier hostnameVerifier() {
        return isValidating()
                ? HttpsURLConnection.getDefaultHostnameVerifier()
                : (hostname, session) -> true;
    }

    public SSLSocketFactory createSocketFactory() throws IOException, GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(keyManagers(), trustManagers(), new SecureRandom());
        return context.getSocketFactory();
    }

    private TrustManager[] trustManagers() throws IOException, GeneralSecurityException {
        if (!isValidating()) {
            return new TrustManager[]{new TrustAllManager()};
        }
        if (caCertsFile == null) {
            return null; // JVM default trust store
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        List<X509Certificate> caCerts = CertificateUtils.readCertificates(caCertsFile);
        for (int i = 0; i < caCerts.size(); i++) {
            trustStore.setCertificateEntry("ca-" + i, caCerts.get(i));
        }
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(trustStore);
        return factory.getTrustManagers();
    }

    private KeyManager[] keyManagers() throws IOException, GeneralSecurityException {
        if (!isValidating() || certificateFile == null || privateKeyFile == null) {
            return null;
        }
        List<X509Certificate> chain = CertificateUtils.readCertificates(certificateFile);
        PrivateKey key = CertificateUtils.readPrivateKey(privateKeyFile);

        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, null);
        keyStore.setKeyEntry("client", key, IN_MEMORY_STORE_PASSWORD, chain.toArray(new X509Certificate[0]));
        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore, IN_MEMORY_STORE_PASSWORD);
        return factory.getKeyManagers();
    }

    /**
     * Accepts any server certificate. Extends the "extended" variant so the JDK does
     * not wrap it with its own endpoint identification check.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
