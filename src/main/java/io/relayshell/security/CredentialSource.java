package io.relayshell.security;

import io.relayshell.config.ServerProfile;

import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Optional;

/**
 * Supplies the local identity and the pinned host keys. Where the material is stored is the
 * caller's business.
 */
public interface CredentialSource {

    String identity();

    KeyPair identityKeys();

    /**
     * The host key the client expects for {@code profile}; empty means the host is unknown and
     * any connection attempt to it must be refused.
     */
    Optional<PublicKey> pinnedHostKey(ServerProfile profile);
}
