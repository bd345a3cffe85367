package io.relayshell.security;

import io.relayshell.util.Hashing;

import javax.crypto.KeyAgreement;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 identity keys and X25519 ephemeral keys, plus their textual encodings.
 */
public final class KeyMaterial {
    public static final String IDENTITY_ALGORITHM = "Ed25519";
    public static final String EPHEMERAL_ALGORITHM = "X25519";

    private KeyMaterial() {
    }

    public static KeyPair generateIdentity() {
        return generate(IDENTITY_ALGORITHM);
    }

    public static KeyPair generateEphemeral() {
        return generate(EPHEMERAL_ALGORITHM);
    }

    public static String encodePublic(PublicKey key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    public static String encodePrivate(PrivateKey key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    public static PublicKey decodeIdentityPublic(String base64) {
        return decodePublic(base64, IDENTITY_ALGORITHM);
    }

    public static PublicKey decodeEphemeralPublic(String base64) {
        return decodePublic(base64, EPHEMERAL_ALGORITHM);
    }

    public static PrivateKey decodeIdentityPrivate(String base64) {
        try {
            byte[] raw = Base64.getDecoder().decode(base64.trim());
            return KeyFactory.getInstance(IDENTITY_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(raw));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + IDENTITY_ALGORITHM + " private key", e);
        }
    }

    public static String fingerprint(PublicKey key) {
        return Hashing.sha256Hex(key.getEncoded());
    }

    public static byte[] sign(PrivateKey key, byte[] message) {
        try {
            Signature signature = Signature.getInstance(IDENTITY_ALGORITHM);
            signature.initSign(key);
            signature.update(message);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("signing failed", e);
        }
    }

    public static boolean verify(PublicKey key, byte[] message, byte[] signatureBytes) {
        try {
            Signature signature = Signature.getInstance(IDENTITY_ALGORITHM);
            signature.initVerify(key);
            signature.update(message);
            return signature.verify(signatureBytes);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    public static byte[] agree(PrivateKey ephemeralPrivate, PublicKey peerEphemeral) {
        try {
            KeyAgreement agreement = KeyAgreement.getInstance(EPHEMERAL_ALGORITHM);
            agreement.init(ephemeralPrivate);
            agreement.doPhase(peerEphemeral, true);
            return agreement.generateSecret();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("key agreement failed", e);
        }
    }

    private static KeyPair generate(String algorithm) {
        try {
            return KeyPairGenerator.getInstance(algorithm).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm + " unavailable", e);
        }
    }

    private static PublicKey decodePublic(String base64, String algorithm) {
        try {
            byte[] raw = Base64.getDecoder().decode(base64.trim());
            return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(raw));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + algorithm + " public key", e);
        }
    }
}
