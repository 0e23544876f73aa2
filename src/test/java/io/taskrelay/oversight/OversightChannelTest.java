package io.taskrelay.oversight;

import io.taskrelay.config.TaskRelayConfig;
import io.taskrelay.dedup.DeduplicationGuard;
import io.taskrelay.model.Directive;
import io.taskrelay.model.DirectiveStatus;
import io.taskrelay.model.DirectiveType;
import io.taskrelay.model.WorkType;
import io.taskrelay.storage.Database;
import io.taskrelay.storage.TaskStore;
import io.taskrelay.testing.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

final class OversightChannelTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void pendingDirectivesAreOrderedByUrgencyThenAge() throws Exception {
        Path root = TestRoots.create("oversight-order");
        try {
            Database db = open(root);
            OversightChannel channel = new OversightChannel(db, new TaskStore(db));
            String guidance = channel.send(DirectiveType.GUIDANCE, "prefer small commits", "w1", null, NOW);
            String broadcast = channel.send(DirectiveType.CONSTRAINT, "do not touch prod", null, null, NOW + 1);
            String abort = channel.send(DirectiveType.ABORT_TASK, "", "w1", null, NOW + 2);
            channel.send(DirectiveType.GUIDANCE, "for someone else", "w2", null, NOW + 3);

            List<String> order = channel.pendingFor("w1").stream().map(Directive::directiveId).toList();
            Assertions.assertEquals(List.of(abort, broadcast, guidance), order);
            Assertions.assertTrue(channel.get(broadcast).orElseThrow().broadcast());
            Assertions.assertEquals(4, channel.countPending());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void acknowledgeIsOneShot() throws Exception {
        Path root = TestRoots.create("oversight-ack");
        try {
            Database db = open(root);
            OversightChannel channel = new OversightChannel(db, new TaskStore(db));
            String id = channel.send(DirectiveType.ESCALATION_RULE, "page on-call after 2 failures", "w1", null, NOW);

            Assertions.assertTrue(channel.acknowledge(id, "w1", NOW + 5));
            Assertions.assertFalse(channel.acknowledge(id, "w1", NOW + 6));
            Directive acked = channel.get(id).orElseThrow();
            Assertions.assertEquals(DirectiveStatus.ACKNOWLEDGED, acked.status());
            Assertions.assertEquals("w1", acked.acknowledgedBy());
            Assertions.assertEquals(NOW + 5, acked.acknowledgedAtMs());
            Assertions.assertTrue(channel.pendingFor("w1").isEmpty());
            Assertions.assertFalse(channel.acknowledge("dir_missing", "w1", NOW));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void priorityChangeIsAppliedOnAcknowledge() throws Exception {
        Path root = TestRoots.create("oversight-priority");
        try {
            Database db = open(root);
            TaskStore store = new TaskStore(db);
            OversightChannel channel = new OversightChannel(db, store);
            TaskStore.NewTask task = new TaskStore.NewTask("write docs", 50, WorkType.DEVELOPMENT, null, 3, 30,
                    DeduplicationGuard.fingerprint("write docs"), "/proj", null, NOW);
            long taskId = db.inTransaction("insert", c -> store.insertPending(c, task));

            String id = channel.send(DirectiveType.PRIORITY_CHANGE, "{\"task_id\": " + taskId + ", \"priority\": 900}", null, null, NOW);
            Assertions.assertEquals(List.of(id),
                    channel.pendingOfType(DirectiveType.PRIORITY_CHANGE).stream().map(Directive::directiveId).toList());
            Assertions.assertTrue(channel.acknowledge(id, "scheduler", NOW + 1));
            Assertions.assertEquals(900, store.getTask(taskId).orElseThrow().priority());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void invalidDirectivesAreRejected() throws Exception {
        Path root = TestRoots.create("oversight-invalid");
        try {
            Database db = open(root);
            OversightChannel channel = new OversightChannel(db, new TaskStore(db));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> channel.send(DirectiveType.GUIDANCE, "  ", "w1", null, NOW));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> channel.send(DirectiveType.ABORT_TASK, "stop", "all", null, NOW));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> channel.send(DirectiveType.PRIORITY_CHANGE, "high", null, 1L, NOW));
            Assertions.assertEquals(0, channel.countPending());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void priorityChangeFormats() {
        Assertions.assertEquals(new OversightChannel.PriorityChange(7L, 300),
                OversightChannel.parsePriorityChange("{\"task_id\":7,\"priority\":300}", null));
        Assertions.assertEquals(new OversightChannel.PriorityChange(7L, 300),
                OversightChannel.parsePriorityChange("{\"priority\":300}", 7L));
        Assertions.assertEquals(new OversightChannel.PriorityChange(9L, 10),
                OversightChannel.parsePriorityChange("10", 9L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> OversightChannel.parsePriorityChange("10", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> OversightChannel.parsePriorityChange("1001", 9L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> OversightChannel.parsePriorityChange("{bad", 9L));
    }

    private static Database open(Path root) {
        Database db = new Database(TaskRelayConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }
}
