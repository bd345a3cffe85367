package io.relayshell.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relayshell.config.ServerProfile;
import io.relayshell.security.AuthorizedKeys;
import io.relayshell.security.CredentialSource;
import io.relayshell.security.KeyMaterial;
import io.relayshell.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credentials read from a JSON key file. The same file shape serves both ends: a client uses
 * {@code host_keys} (profile name to pinned host key), an agent uses {@code authorized_keys}
 * (client identity to public key). Keys are Base64 encoded.
 */
public final class KeyFileCredentialSource implements CredentialSource {
    private final String identity;
    private final KeyPair keys;
    private final Map<String, PublicKey> hostKeys;

    private KeyFileCredentialSource(String identity, KeyPair keys, Map<String, PublicKey> hostKeys) {
        this.identity = identity;
        this.keys = keys;
        this.hostKeys = hostKeys;
    }

    public static KeyFileCredentialSource load(Path file) throws IOException {
        return from(readKeyFile(file));
    }

    public static KeyFileCredentialSource from(KeyFile keyFile) {
        Map<String, PublicKey> pinned = new LinkedHashMap<>();
        if (keyFile.hostKeys() != null) {
            keyFile.hostKeys().forEach((name, encoded) -> pinned.put(name, KeyMaterial.decodeIdentityPublic(encoded)));
        }
        return new KeyFileCredentialSource(keyFile.identity(), keyFile.keyPair(), Map.copyOf(pinned));
    }

    public static KeyFile readKeyFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("key file not found: " + file);
        }
        KeyFile keyFile = Jsons.mapper().readValue(file.toFile(), KeyFile.class);
        if (keyFile.identity() == null || keyFile.identity().isBlank()) {
            throw new IOException("key file has no identity: " + file);
        }
        if (keyFile.publicKey() == null || keyFile.privateKey() == null) {
            throw new IOException("key file is missing key material: " + file);
        }
        return keyFile;
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public KeyPair identityKeys() {
        return keys;
    }

    @Override
    public Optional<PublicKey> pinnedHostKey(ServerProfile profile) {
        return Optional.ofNullable(hostKeys.get(profile.name()));
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record KeyFile(
            String identity,
            @JsonProperty("public_key") String publicKey,
            @JsonProperty("private_key") String privateKey,
            @JsonProperty("host_keys") Map<String, String> hostKeys,
            @JsonProperty("authorized_keys") Map<String, String> authorizedKeys
    ) {
        public static KeyFile generate(String identity) {
            KeyPair pair = KeyMaterial.generateIdentity();
            return new KeyFile(
                    identity,
                    KeyMaterial.encodePublic(pair.getPublic()),
                    KeyMaterial.encodePrivate(pair.getPrivate()),
                    Map.of(),
                    Map.of()
            );
        }

        public KeyPair keyPair() {
            return new KeyPair(KeyMaterial.decodeIdentityPublic(publicKey), KeyMaterial.decodeIdentityPrivate(privateKey));
        }

        public AuthorizedKeys toAuthorizedKeys() {
            AuthorizedKeys authorized = new AuthorizedKeys();
            if (authorizedKeys != null) {
                authorizedKeys.forEach((name, encoded) -> authorized.authorize(name, KeyMaterial.decodeIdentityPublic(encoded)));
            }
            return authorized;
        }
    }
}
