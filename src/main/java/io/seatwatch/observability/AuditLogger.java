package io.seatwatch.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.seatwatch.security.SensitiveDataMasker;
import io.seatwatch.util.Hashing;
import io.seatwatch.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("job_id", event.jobId());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log", e);
        }
    }

    /**
     * Walks the chain from the first row, recomputing each hash and checking each
     * {@code prev_hash} link and, when a signing secret is configured, each signature.
     */
    public synchronized Verification verify() {
        List<String> lines = readLines();
        int rows = 0;
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return Verification.broken(rows, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            String prevHash = parsed.path("prev_hash").asText("");
            if (!prevHash.equals(expectedPrev)) {
                return Verification.broken(rows, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = ((ObjectNode) parsed).deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return Verification.broken(rows, i + 1, "hash_mismatch");
            }
            if (!signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret, hash).equals(parsed.path("signature").asText(""))) {
                return Verification.broken(rows, i + 1, "signature_mismatch");
            }
            expectedPrev = hash;
        }
        return new Verification(true, rows, 0, "");
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
            throw new IllegalStateException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    private Object sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return SensitiveDataMasker.masked(node);
    }

    public record AuditEvent(
            String action,
            String actor,
            String jobId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String jobId, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, jobId, result, details == null ? Map.of() : details);
        }
    }

    public record Verification(boolean valid, int rows, int brokenLine, String reason) {
        static Verification broken(int rows, int line, String reason) {
            return new Verification(false, rows, line, reason);
        }
    }
}
