package io.taskrelay.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.util.Hashing;
import io.taskrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON lines audit trail. Each row carries the hash of the previous row,
 * so truncation or in-place edits are detected by {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;
    private long knownSize;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
        this.knownSize = currentSize();
    }

    public synchronized void log(AuditEvent event) {
        if (currentSize() != knownSize) {
            // another process appended since our last write
            previousHash = loadLastHash();
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("worker", event.worker());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + "\n";
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
            knownSize = currentSize();
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new IllegalStateException("Corrupt audit row: " + abbreviate(line), e);
            }
        }
        return out;
    }

    /**
     * Re-hashes every row and checks each links to its predecessor.
     */
    public VerifyResult verify() {
        String expectedPrev = "";
        int rows = 0;
        for (String line : readLines()) {
            rows++;
            LinkedHashMap<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, ROW_TYPE);
            } catch (IOException e) {
                return new VerifyResult(false, rows, "row " + rows + " is not valid JSON");
            }
            Object hash = row.remove("hash");
            Object prev = row.get("prev_hash");
            if (!expectedPrev.equals(prev)) {
                return new VerifyResult(false, rows, "row " + rows + " does not link to its predecessor");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(hash)) {
                return new VerifyResult(false, rows, "row " + rows + " hash mismatch");
            }
            expectedPrev = recomputed;
        }
        return new VerifyResult(true, rows, null);
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            List<String> lines = readLines();
            if (lines.isEmpty()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(lines.get(lines.size() - 1));
            return node.path("hash").asText("");
        } catch (IOException | RuntimeException e) {
            log.warn("Audit log tail unreadable, starting a new chain: {}", e.getMessage());
            return "";
        }
    }

    private long currentSize() {
        try {
            return Files.size(auditFile);
        } catch (IOException e) {
            return -1L;
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 120) + "...";
    }

    public record VerifyResult(boolean valid, int rows, String problem) {}

    public record AuditEvent(
            String action,
            String actor,
            String result,
            Long taskId,
            String worker,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String result, Long taskId, String worker,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor, result, taskId, worker, details == null ? Map.of() : details);
        }
    }
}
