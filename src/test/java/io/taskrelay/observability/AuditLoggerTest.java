package io.taskrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.testing.MutableClock;
import io.taskrelay.testing.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopen() throws Exception {
        Path root = TestRoots.create("audit-reopen");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            AuditLogger first = new AuditLogger(file, clock);
            first.log(AuditLogger.AuditEvent.of("task.submit", "cli", "queued", 1L, null, Map.of("priority", 70)));
            first.log(AuditLogger.AuditEvent.of("task.dispatch", "dispatcher", "sent", 1L, "w1", Map.of()));

            AuditLogger reopened = new AuditLogger(file, clock);
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("task.complete", "monitor", "completed", 1L, "w1", null));

            AuditLogger.VerifyResult result = reopened.verify();
            Assertions.assertTrue(result.valid(), result.problem());
            Assertions.assertEquals(3, result.rows());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path root = TestRoots.create("audit-tamper");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, new MutableClock(1_700_000_000_000L));
            audit.log(AuditLogger.AuditEvent.of("task.submit", "cli", "queued", 1L, null, Map.of()));
            audit.log(AuditLogger.AuditEvent.of("task.cancel", "operator", "cancelled", 1L, null, Map.of("reason", "dup")));
            audit.log(AuditLogger.AuditEvent.of("task.submit", "cli", "queued", 2L, null, Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"cancelled\"", "\"completed\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = audit.verify();
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals(2, result.rows());
            Assertions.assertEquals("row 2 hash mismatch", result.problem());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void droppedRowBreaksTheLink() throws Exception {
        Path root = TestRoots.create("audit-drop");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, new MutableClock(1_700_000_000_000L));
            for (long id = 1; id <= 3; id++) {
                audit.log(AuditLogger.AuditEvent.of("task.submit", "cli", "queued", id, null, Map.of()));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyResult result = audit.verify();
            Assertions.assertFalse(result.valid());
            Assertions.assertEquals("row 2 does not link to its predecessor", result.problem());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void tailReturnsNewestRowsOldestFirst() throws Exception {
        Path root = TestRoots.create("audit-tail");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), new MutableClock(1_700_000_000_000L));
            for (long id = 1; id <= 5; id++) {
                audit.log(AuditLogger.AuditEvent.of("task.submit", "cli", "queued", id, null, Map.of()));
            }
            List<JsonNode> tail = audit.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals(4, tail.get(0).path("task_id").asLong());
            Assertions.assertEquals(5, tail.get(1).path("task_id").asLong());
            Assertions.assertEquals(tail.get(0).path("hash").asText(), tail.get(1).path("prev_hash").asText());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }
}
