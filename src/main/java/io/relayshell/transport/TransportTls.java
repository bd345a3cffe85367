package io.relayshell.transport;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.util.Enumeration;
import java.util.HexFormat;

/**
 * TLS material for the outer transport.
 *
 * <p>The agent's identity is proved by the key handshake that follows, not by its certificate,
 * so a client without a truststore accepts any certificate the agent presents.
 */
public final class TransportTls {
    private static final String[] PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private TransportTls() {
    }

    public static SSLContext clientContext(String truststorePath, String truststorePass, String truststoreType) throws Exception {
        TrustManager[] trustManagers;
        if (truststorePath == null || truststorePath.isBlank()) {
            trustManagers = new TrustManager[]{new HandshakeVerifiedTrustManager()};
        } else {
            KeyStore trustStore = loadKeyStore(
                    Path.of(truststorePath),
                    truststorePass == null ? "" : truststorePass,
                    blankToDefault(truststoreType, "PKCS12")
            );
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            trustManagers = tmf.getTrustManagers();
        }
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(null, trustManagers, null);
        return ssl;
    }

    public static AgentTls agentContext(String keystorePath, String keystorePass, String keystoreType) throws Exception {
        if (keystorePath == null || keystorePath.isBlank()) {
            throw new IllegalArgumentException("keystore path is required");
        }
        if (keystorePass == null) {
            throw new IllegalArgumentException("keystore password is required");
        }
        KeyStore keyStore = loadKeyStore(Path.of(keystorePath), keystorePass, blankToDefault(keystoreType, "PKCS12"));
        X509Certificate cert = findCertificate(keyStore);
        if (cert == null) {
            throw new IllegalArgumentException("No X509 certificate found in keystore: " + keystorePath);
        }
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, keystorePass.toCharArray());
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(kmf.getKeyManagers(), null, null);
        return new AgentTls(
                ssl,
                fingerprintSha256(cert),
                cert.getSubjectX500Principal().getName(),
                cert.getNotAfter().toInstant().toString()
        );
    }

    public static String[] protocols() {
        return PROTOCOLS.clone();
    }

    public static String fingerprintSha256(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (Exception e) {
            throw new RuntimeException("failed to compute certificate fingerprint", e);
        }
    }

    private static String blankToDefault(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw;
    }

    private static KeyStore loadKeyStore(Path path, String password, String type) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        try (var in = Files.newInputStream(path)) {
            keyStore.load(in, password == null ? new char[0] : password.toCharArray());
        }
        return keyStore;
    }

    private static X509Certificate findCertificate(KeyStore keyStore) throws GeneralSecurityException {
        Enumeration<String> aliases = keyStore.aliases();
        while (aliases.hasMoreElements()) {
            String alias = aliases.nextElement();
            if (!keyStore.isKeyEntry(alias) && !keyStore.isCertificateEntry(alias)) {
                continue;
            }
            var cert = keyStore.getCertificate(alias);
            if (cert instanceof X509Certificate x509) {
                return x509;
            }
        }
        return null;
    }

    public record AgentTls(SSLContext sslContext, String certFingerprintSha256, String certSubject, String certNotAfterIso) {
    }

    private static final class HandshakeVerifiedTrustManager extends X509ExtendedTrustManager {
        private static final X509Certificate[] NONE = new X509Certificate[0];

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

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
        public X509Certificate[] getAcceptedIssuers() {
            return NONE;
        }
    }
}
