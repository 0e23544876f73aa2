package io.taskrelay.session;

import io.taskrelay.config.RelaySettings;
import io.taskrelay.model.WorkType;
import io.taskrelay.model.WorkerStatus;
import io.taskrelay.model.WorkerView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

final class LocalSessionDriverTest {
    private static final WorkerView WORKER = new WorkerView("w1", WorkerView.LOCAL, "relay:w1", EnumSet.allOf(WorkType.class),
            WorkerStatus.IDLE, null, 0L, 0L, null, 0L);

    private final List<List<String>> commands = new ArrayList<>();
    private final LocalSessionDriver driver = new LocalSessionDriver((command, timeoutMs) -> {
        commands.add(command);
        return new CommandResult(0, "", false);
    }, RelaySettings::defaults);

    @Test
    void shortTextIsTypedLiterallyThenSubmitted() {
        Assertions.assertTrue(driver.inject(WORKER, "fix the login bug").delivered());
        Assertions.assertEquals(List.of(
                List.of("tmux", "send-keys", "-t", "relay:w1", "-l", "--", "fix the login bug"),
                List.of("tmux", "send-keys", "-t", "relay:w1", "Enter")
        ), commands);
    }

    @Test
    void longOrMultiLineTextGetsExtraEnter() {
        driver.inject(WORKER, "x".repeat(201));
        Assertions.assertEquals(3, commands.size());
        commands.clear();
        driver.inject(WORKER, "line one\nline two");
        Assertions.assertEquals(3, commands.size());
        Assertions.assertEquals(List.of("tmux", "send-keys", "-t", "relay:w1", "Enter"), commands.get(2));
        commands.clear();
        driver.inject(WORKER, "x".repeat(200));
        Assertions.assertEquals(2, commands.size());
    }

    @Test
    void namedKeysAreSentAsKeysAndOthersLiterally() {
        driver.sendKeys(WORKER, List.of("1", "Enter"));
        Assertions.assertEquals(List.of("tmux", "send-keys", "-t", "relay:w1", "-l", "--", "1"), commands.get(0));
        Assertions.assertEquals(List.of("tmux", "send-keys", "-t", "relay:w1", "Enter"), commands.get(1));
    }

    @Test
    void captureReadsPaneTail() {
        CaptureResult result = driver.capture(WORKER, 50);
        Assertions.assertTrue(result.captured());
        Assertions.assertEquals(List.of("tmux", "capture-pane", "-p", "-J", "-t", "relay:w1", "-S", "-50"), commands.get(0));
    }

    @Test
    void failedCommandStopsDelivery() {
        LocalSessionDriver broken = new LocalSessionDriver((command, timeoutMs) -> {
            commands.add(command);
            return new CommandResult(1, "can't find session: relay:w1\n", false);
        }, RelaySettings::defaults);
        DeliveryResult result = broken.inject(WORKER, "anything");
        Assertions.assertFalse(result.delivered());
        Assertions.assertEquals("exit=1 can't find session: relay:w1", result.error());
        Assertions.assertEquals(1, commands.size());
        Assertions.assertFalse(broken.capture(WORKER, 10).captured());
    }

    @Test
    void emptyTextIsNotDelivered() {
        Assertions.assertFalse(driver.inject(WORKER, "").delivered());
        Assertions.assertTrue(commands.isEmpty());
    }
}
