package io.relayshell.security;

import java.security.PublicKey;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client identities the agent accepts, keyed by identity name.
 */
public final class AuthorizedKeys {
    private final Map<String, PublicKey> keys = new ConcurrentHashMap<>();

    public AuthorizedKeys authorize(String identity, PublicKey key) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be empty");
        }
        keys.put(identity.trim(), key);
        return this;
    }

    public Optional<PublicKey> lookup(String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(identity.trim()));
    }

    public int size() {
        return keys.size();
    }
}
