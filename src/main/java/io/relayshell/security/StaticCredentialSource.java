package io.relayshell.security;

import io.relayshell.config.ServerProfile;

import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Map;
import java.util.Optional;

/**
 * Credentials held in memory; host keys are looked up by profile name.
 */
public record StaticCredentialSource(String identity, KeyPair identityKeys, Map<String, PublicKey> hostKeys)
        implements CredentialSource {
    public StaticCredentialSource {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be empty");
        }
        if (identityKeys == null) {
            throw new IllegalArgumentException("identity keys are required");
        }
        hostKeys = hostKeys == null ? Map.of() : Map.copyOf(hostKeys);
    }

    @Override
    public Optional<PublicKey> pinnedHostKey(ServerProfile profile) {
        return Optional.ofNullable(hostKeys.get(profile.name()));
    }
}
