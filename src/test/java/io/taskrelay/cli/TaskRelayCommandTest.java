package io.taskrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.testing.TestRoots;
import io.taskrelay.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

final class TaskRelayCommandTest {
    private Path root;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        root = TestRoots.create("cli");
    }

    @AfterEach
    void tearDown() throws Exception {
        TestRoots.deleteRecursively(root);
    }

    @Test
    void noSubcommandPrintsUsageAndFails() {
        Assertions.assertEquals(1, run());
        Assertions.assertTrue(err.toString().contains("Usage: taskrelay"));
    }

    @Test
    void assignWithoutDirectoryIsAUsageError() {
        Assertions.assertEquals(1, run("assign", "fix bug"));
        Assertions.assertTrue(err.toString().contains("Missing required parameter"));
    }

    @Test
    void initCreatesDatabase() {
        Assertions.assertEquals(0, run("init"));
        Assertions.assertTrue(Files.isRegularFile(root.resolve("taskrelay.db")));
    }

    @Test
    void assignQueuesTaskWhenNoWorkerIsIdle() throws Exception {
        Assertions.assertEquals(0, run("assign", "fix bug in parser", "/tmp/proj"));
        JsonNode printed = Jsons.mapper().readTree(out.toString());
        Assertions.assertFalse(printed.path("submit").path("duplicate").asBoolean());
        Assertions.assertEquals("NO_WORKER_AVAILABLE", printed.path("dispatch").path("outcome").asText());
        long id = printed.path("submit").path("taskId").asLong();

        Assertions.assertEquals(0, run("task", String.valueOf(id)));
        JsonNode task = Jsons.mapper().readTree(out.toString());
        Assertions.assertEquals("PENDING", task.path("status").asText());
        Assertions.assertEquals("fix bug in parser", task.path("content").asText());
    }

    @Test
    void repeatedAssignReportsDuplicateWithoutDispatching() throws Exception {
        Assertions.assertEquals(0, run("assign", "review pull request 42", "/tmp/proj", "--queue-only"));
        Assertions.assertEquals(0, run("assign", "review pull request 42", "/tmp/proj"));
        JsonNode printed = Jsons.mapper().readTree(out.toString());
        Assertions.assertTrue(printed.path("submit").path("duplicate").asBoolean());
        Assertions.assertTrue(printed.path("dispatch").isMissingNode());
    }

    @Test
    void assignToUnknownWorkerIsRejected() {
        Assertions.assertEquals(1, run("assign", "fix bug", "/tmp/proj", "ghost"));
        Assertions.assertTrue(err.toString().contains("error: Unknown worker: ghost"));
    }

    @Test
    void registeredWorkerIsListed() throws Exception {
        Assertions.assertEquals(0, run("worker-register", "w1", "--affinity", "review,test"));
        Assertions.assertEquals(0, run("workers"));
        JsonNode workers = Jsons.mapper().readTree(out.toString());
        Assertions.assertEquals(1, workers.size());
        Assertions.assertEquals("w1", workers.get(0).path("name").asText());
        Assertions.assertEquals("IDLE", workers.get(0).path("status").asText());
    }

    @Test
    void completeForUnknownWorkerFails() {
        Assertions.assertEquals(1, run("complete", "nobody"));
        Assertions.assertTrue(err.toString().contains("Unknown worker: nobody"));
    }

    @Test
    void missingTaskFails() {
        Assertions.assertEquals(1, run("task", "999"));
        Assertions.assertTrue(out.toString().contains("task not found"));
    }

    @Test
    void statusAndStatsSucceedOnEmptyRoot() throws Exception {
        Assertions.assertEquals(0, run("status"));
        Assertions.assertEquals(0, run("stats"));
        JsonNode stats = Jsons.mapper().readTree(out.toString());
        Assertions.assertEquals(0, stats.path("tasks").path("PENDING").asInt());
        Assertions.assertEquals(0, stats.path("activeLocks").asInt());
    }

    @Test
    void auditVerifyPassesAfterActivity() throws Exception {
        run("assign", "fix flaky build", "/tmp/proj", "--queue-only");
        run("cancel", "1", "--reason", "not needed");
        Assertions.assertEquals(0, run("audit-verify"));
        JsonNode verify = Jsons.mapper().readTree(out.toString());
        Assertions.assertTrue(verify.path("valid").asBoolean());
        Assertions.assertEquals(2, verify.path("rows").asInt());
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = TaskRelayCommand.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cmd.execute(full);
    }
}
