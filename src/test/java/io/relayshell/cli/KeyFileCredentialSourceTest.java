package io.relayshell.cli;

import io.relayshell.config.ServerProfile;
import io.relayshell.security.KeyMaterial;
import io.relayshell.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

final class KeyFileCredentialSourceTest {
    private Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        tempDir = Files.createTempDirectory("relayshell-keys-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(tempDir);
    }

    @Test
    void loadsIdentityAndPinnedHostKeys() throws Exception {
        KeyPair host = KeyMaterial.generateIdentity();
        KeyPair client = KeyMaterial.generateIdentity();
        KeyFileCredentialSource.KeyFile generated = KeyFileCredentialSource.KeyFile.generate("ops");
        KeyFileCredentialSource.KeyFile withPins = new KeyFileCredentialSource.KeyFile(
                generated.identity(),
                generated.publicKey(),
                generated.privateKey(),
                Map.of("box", KeyMaterial.encodePublic(host.getPublic())),
                Map.of("deploy", KeyMaterial.encodePublic(client.getPublic()))
        );
        Path file = tempDir.resolve("keys.json");
        Jsons.mapper().writeValue(file.toFile(), withPins);

        KeyFileCredentialSource source = KeyFileCredentialSource.load(file);

        Assertions.assertEquals("ops", source.identity());
        Assertions.assertEquals(generated.keyPair().getPublic(), source.identityKeys().getPublic());
        ServerProfile box = ServerProfile.builder("box", "127.0.0.1", 443).build();
        ServerProfile other = ServerProfile.builder("other", "127.0.0.1", 443).build();
        Assertions.assertEquals(host.getPublic(), source.pinnedHostKey(box).orElseThrow());
        Assertions.assertTrue(source.pinnedHostKey(other).isEmpty());
        Assertions.assertEquals(client.getPublic(), withPins.toAuthorizedKeys().lookup("deploy").orElseThrow());
    }

    @Test
    void writtenFileUsesSnakeCaseKeys() throws Exception {
        Path file = tempDir.resolve("keys.json");
        Jsons.mapper().writeValue(file.toFile(), KeyFileCredentialSource.KeyFile.generate("ops"));

        String json = Files.readString(file);
        Assertions.assertTrue(json.contains("\"public_key\""), json);
        Assertions.assertTrue(json.contains("\"private_key\""), json);
        Assertions.assertFalse(json.contains("host_keys"), json);
    }

    @Test
    void rejectsMissingOrIncompleteFiles() throws Exception {
        Assertions.assertThrows(IOException.class, () -> KeyFileCredentialSource.load(tempDir.resolve("absent.json")));

        Path incomplete = tempDir.resolve("incomplete.json");
        Files.writeString(incomplete, "{\"identity\":\"ops\"}");
        Assertions.assertThrows(IOException.class, () -> KeyFileCredentialSource.load(incomplete));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ignored) {
                }
            });
        }
    }
}
