package io.taskrelay.storage;

import io.taskrelay.config.TaskRelayConfig;
import io.taskrelay.model.WorkType;
import io.taskrelay.model.WorkerStatus;
import io.taskrelay.model.WorkerView;
import io.taskrelay.testing.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

final class WorkerRegistryTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void registerDefaultsAndUpsert() throws Exception {
        Path root = TestRoots.create("workers-register");
        try {
            WorkerRegistry workers = new WorkerRegistry(open(root));
            WorkerView w = workers.register("w1", null, null, EnumSet.allOf(WorkType.class), NOW);
            Assertions.assertEquals(WorkerView.LOCAL, w.location());
            Assertions.assertEquals("w1", w.session());
            Assertions.assertEquals(WorkerStatus.IDLE, w.status());
            Assertions.assertFalse(w.remote());

            WorkerView moved = workers.register("w1", "ops@box", "main:2", EnumSet.of(WorkType.REVIEW), NOW + 1);
            Assertions.assertTrue(moved.remote());
            Assertions.assertEquals("main:2", moved.session());
            Assertions.assertEquals(EnumSet.of(WorkType.REVIEW), moved.affinity());
            Assertions.assertEquals(1, workers.list().size());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> workers.register("bad name;", null, null, EnumSet.allOf(WorkType.class), NOW));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> workers.register("w2", "-oProxyCommand=touch /tmp/x", null, EnumSet.allOf(WorkType.class), NOW));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> workers.register("w2", "ops@box extra", null, EnumSet.allOf(WorkType.class), NOW));
            Assertions.assertEquals(1, workers.list().size());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void eligibleWorkersAreIdleMatchingAndLeastRecentlyAssigned() throws Exception {
        Path root = TestRoots.create("workers-eligible");
        try {
            Database db = open(root);
            WorkerRegistry workers = new WorkerRegistry(db);
            workers.register("b", null, null, EnumSet.allOf(WorkType.class), NOW);
            workers.register("a", null, null, EnumSet.allOf(WorkType.class), NOW);
            workers.register("reviewer", null, null, EnumSet.of(WorkType.REVIEW), NOW);

            Assertions.assertEquals(List.of("a", "b"),
                    workers.listEligible(WorkType.DEPLOYMENT, null).stream().map(WorkerView::name).toList());
            Assertions.assertEquals(List.of("a", "b", "reviewer"),
                    workers.listEligible(WorkType.REVIEW, null).stream().map(WorkerView::name).toList());
            Assertions.assertEquals(List.of("b"),
                    workers.listEligible(WorkType.DEPLOYMENT, "b").stream().map(WorkerView::name).toList());
            Assertions.assertTrue(workers.listEligible(WorkType.DEPLOYMENT, "reviewer").isEmpty());

            Assertions.assertTrue(db.<Boolean>inTransaction("claim", c -> workers.claim(c, "a", 1L, NOW + 10)));
            Assertions.assertFalse(db.<Boolean>inTransaction("claim", c -> workers.claim(c, "a", 2L, NOW + 10)));
            Assertions.assertEquals(List.of("b"),
                    workers.listEligible(WorkType.DEPLOYMENT, null).stream().map(WorkerView::name).toList());

            Assertions.assertTrue(db.<Boolean>inTransaction("release", c -> workers.release(c, "a", 1L, NOW + 20)));
            Assertions.assertEquals(List.of("b", "a"),
                    workers.listEligible(WorkType.DEPLOYMENT, null).stream().map(WorkerView::name).toList());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void unreachableWorkerStaysUnreachableUntilRestored() throws Exception {
        Path root = TestRoots.create("workers-unreachable");
        try {
            Database db = open(root);
            WorkerRegistry workers = new WorkerRegistry(db);
            workers.register("w1", null, null, EnumSet.allOf(WorkType.class), NOW);
            db.inTransaction("claim", c -> workers.claim(c, "w1", 7L, NOW));

            Assertions.assertTrue(workers.markUnreachable("w1", NOW + 1));
            Assertions.assertFalse(workers.markUnreachable("w1", NOW + 2));
            Assertions.assertTrue(workers.restore("w1", NOW + 3));
            Assertions.assertEquals(WorkerStatus.BUSY, workers.get("w1").orElseThrow().status());

            workers.markUnreachable("w1", NOW + 4);
            db.inTransaction("release", c -> workers.release(c, "w1", 7L, NOW + 5));
            Assertions.assertEquals(WorkerStatus.UNREACHABLE, workers.get("w1").orElseThrow().status());
            Assertions.assertTrue(workers.listEligible(WorkType.DEVELOPMENT, null).isEmpty());
            workers.restore("w1", NOW + 6);
            Assertions.assertEquals(WorkerStatus.IDLE, workers.get("w1").orElseThrow().status());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void outputDigestOnlyCountsChanges() throws Exception {
        Path root = TestRoots.create("workers-digest");
        try {
            WorkerRegistry workers = new WorkerRegistry(open(root));
            workers.register("w1", null, null, EnumSet.allOf(WorkType.class), NOW);
            Assertions.assertTrue(workers.recordOutput("w1", "aa", NOW + 1));
            Assertions.assertFalse(workers.recordOutput("w1", "aa", NOW + 2));
            Assertions.assertEquals(NOW + 1, workers.get("w1").orElseThrow().lastActivityAtMs());
            Assertions.assertTrue(workers.recordOutput("w1", "bb", NOW + 3));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void busyWorkerCannotBeRemoved() throws Exception {
        Path root = TestRoots.create("workers-remove");
        try {
            Database db = open(root);
            WorkerRegistry workers = new WorkerRegistry(db);
            workers.register("w1", null, null, EnumSet.allOf(WorkType.class), NOW);
            workers.register("w2", null, null, EnumSet.allOf(WorkType.class), NOW);
            db.inTransaction("claim", c -> workers.claim(c, "w1", 3L, NOW));

            Assertions.assertThrows(IllegalStateException.class, () -> workers.remove("w1"));
            Assertions.assertTrue(workers.remove("w2"));
            Assertions.assertFalse(workers.remove("w2"));
            Assertions.assertEquals(1, workers.countsByStatus().get("BUSY"));
            Assertions.assertEquals(0, workers.countsByStatus().get("IDLE"));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    private static Database open(Path root) {
        Database db = new Database(TaskRelayConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }
}
