package io.playengine.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.playengine.security.SecretRedactor;
import io.playengine.util.Hashing;
import io.playengine.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of run lifecycle events. Each row carries the hash of the previous one,
 * so edits or deletions break the chain. Details are redacted before they are written.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public void log(AuditEvent event) {
        log(event, SecretRedactor.none());
    }

    public synchronized void log(AuditEvent event, SecretRedactor redactor) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("job_kind", event.jobKind());
        row.put("job_id", event.jobId());
        row.put("resource", redactor.redact(event.resource()));
        row.put("result", event.result());
        row.put("details", redactor.redact(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        try {
            Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /** True when every row's {@code prev_hash} and {@code hash} are consistent with its predecessor. */
    public synchronized boolean verifyChain() {
        try {
            String expectedPrev = "";
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = Jsons.mapper().readTree(line);
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return false;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
                String hash = String.valueOf(row.remove("hash"));
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return false;
                }
                expectedPrev = hash;
            }
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Could not read last audit hash from {}, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String jobKind,
            long jobId,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String jobKind, long jobId, String resource, String result,
                                    Map<String, Object> details) {
            return new AuditEvent(action, jobKind, jobId, resource, result, details == null ? Map.of() : details);
        }
    }
}
