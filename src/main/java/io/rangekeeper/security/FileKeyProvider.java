package io.rangekeeper.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rangekeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class FileKeyProvider implements KeyProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FileKeyProvider.class);
    private static final String SCHEMA = "rangekeeper.flag.keys.v1";
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public FileKeyProvider(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    @Override
    public ActiveKey current() {
        Keyring ring = keyring;
        return new ActiveKey(ring.activeKeyId(), ring.keys().get(ring.activeKeyId()));
    }

    @Override
    public Optional<SecretKey> key(int keyId) {
        return Optional.ofNullable(keyring.keys().get(keyId));
    }

    @Override
    public synchronized int rotate() {
        Keyring current = keyring;
        TreeMap<Integer, SecretKey> next = new TreeMap<>(current.keys());
        int keyId = next.isEmpty() ? 1 : next.lastKey() + 1;
        next.put(keyId, newKey());
        Keyring rotated = new Keyring(keyId, Collections.unmodifiableSortedMap(next));
        persistKeyring(rotated);
        keyring = rotated;
        LOG.info("Flag encryption key rotated, active key id={} total keys={}", keyId, next.size());
        return keyId;
    }

    @Override
    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKeyId(), ring.keys().size(), keyFile.toString());
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            LOG.info("Created flag keyring at {}", keyFile);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String schema = node.path("schema").asText("");
            if (!SCHEMA.equals(schema)) {
                throw new IllegalStateException("Unsupported keyring schema '" + schema + "' in " + keyFile);
            }
            int active = node.path("active_key_id").asInt(0);
            JsonNode keysNode = node.path("keys");
            TreeMap<Integer, SecretKey> keys = new TreeMap<>();
            if (keysNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = keysNode.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    String rawBase64 = entry.getValue().asText("");
                    if (rawBase64.isBlank()) {
                        continue;
                    }
                    keys.put(Integer.parseInt(entry.getKey()), new SecretKeySpec(Base64.getDecoder().decode(rawBase64), "AES"));
                }
            }
            if (keys.isEmpty()) {
                throw new IllegalStateException("Keyring " + keyFile + " contains no keys");
            }
            // An unknown active id would make every new credential undecryptable later.
            if (!keys.containsKey(active)) {
                throw new IllegalStateException("Keyring " + keyFile + " names missing active key id " + active);
            }
            return new Keyring(active, Collections.unmodifiableSortedMap(keys));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load flag keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        TreeMap<Integer, SecretKey> keys = new TreeMap<>();
        keys.put(1, newKey());
        return new Keyring(1, Collections.unmodifiableSortedMap(keys));
    }

    private SecretKey newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            ObjectNode keys = Jsons.mapper().createObjectNode();
            for (Map.Entry<Integer, SecretKey> entry : ring.keys().entrySet()) {
                keys.put(String.valueOf(entry.getKey()), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", SCHEMA);
            root.put("active_key_id", ring.activeKeyId());
            root.set("keys", keys);
            Path tmp = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(root), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, keyFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, keyFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist flag keyring: " + keyFile, e);
        }
    }

    private record Keyring(int activeKeyId, Map<Integer, SecretKey> keys) {
    }
}
