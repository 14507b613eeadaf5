package io.playengine.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.playengine.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-GCM encryption for stored credential inputs. Values look like
 * {@code $encrypted$AESGCM$<kid>$<iv>$<ct>} and are only decrypted by the credential injector.
 * Rotation adds a key and keeps the old ones for decryption.
 */
public final class SecretCipher {
    public static final String PREFIX = "$encrypted$AESGCM$";
    private static final String SCHEMA = "playengine.credential.keys.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public SecretCipher(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    public static boolean isEncrypted(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || isEncrypted(plaintext)) {
            return plaintext;
        }
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        if (key == null) {
            throw new IllegalStateException("Credential keyring has no active key: " + keyFile);
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
            return PREFIX + ring.activeKid + "$" + encoder.encodeToString(iv) + "$" + encoder.encodeToString(cipherText);
        } catch (Exception e) {
            throw new RuntimeException("Failed to encrypt credential input", e);
        }
    }

    public String decryptIfNeeded(String value) {
        if (!isEncrypted(value)) {
            return value;
        }
        String[] parts = value.substring(PREFIX.length()).split("\\$", -1);
        if (parts.length != 3 || parts[1].isBlank() || parts[2].isBlank()) {
            throw new IllegalArgumentException("Invalid encrypted credential input format");
        }
        String kid = parts[0];
        byte[] iv;
        byte[] cipherText;
        try {
            iv = Base64.getUrlDecoder().decode(parts[1]);
            cipherText = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid encrypted credential input encoding", e);
        }
        Keyring ring = keyring;
        SecretKeySpec exact = ring.keys.get(kid);
        if (exact != null) {
            return decrypt(cipherText, iv, exact);
        }
        RuntimeException last = null;
        for (SecretKeySpec key : ring.keys.values()) {
            try {
                return decrypt(cipherText, iv, key);
            } catch (RuntimeException e) {
                last = e;
            }
        }
        throw new RuntimeException("Unable to decrypt credential input with current keyring", last);
    }

    public synchronized RotationOutcome rotate() {
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(keyring.keys);
        String kid = nextKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        return new RotationOutcome(kid, next.size(), keyFile.toString());
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKid, ring.keys.size(), keyFile.toString());
    }

    private String decrypt(byte[] cipherText, byte[] iv, SecretKeySpec key) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException("Failed to decrypt credential input", e);
        }
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            if (keysNode.isObject()) {
                keysNode.fieldNames().forEachRemaining(kid -> {
                    String rawBase64 = keysNode.path(kid).asText("");
                    if (!kid.isBlank() && !rawBase64.isBlank()) {
                        keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(rawBase64), "AES"));
                    }
                });
            }
            if (keys.isEmpty()) {
                Keyring created = bootstrapKeyring();
                persistKeyring(created);
                return created;
            }
            if (!keys.containsKey(active)) {
                active = keys.keySet().iterator().next();
            }
            return new Keyring(active, keys);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load credential keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = nextKid(keys);
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    // Key ids never contain '$' and stay unique across fast successive rotations.
    private static String nextKid(Map<String, SecretKeySpec> existing) {
        String base = "k" + Instant.now().toEpochMilli();
        String kid = base;
        int suffix = 1;
        while (existing.containsKey(kid)) {
            kid = base + "-" + suffix++;
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", SCHEMA);
            root.put("active_kid", ring.activeKid);
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
            if (keyFile.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist credential keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record RotationOutcome(String activeKid, int totalKeys, String keyFile) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
