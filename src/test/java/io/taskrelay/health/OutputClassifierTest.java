package io.taskrelay.health;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class OutputClassifierTest {
    private final OutputClassifier classifier = new OutputClassifier(OutputPatterns.defaults());

    @Test
    void confirmationPromptIsBlockedWithPromptAsEvidence() {
        String pane = "Edited src/App.java\nDo you want to proceed?\n❯ 1. Yes\n  2. No\n";
        Observation observation = classifier.classify(pane);
        Assertions.assertEquals(ObservationKind.BLOCKED, observation.kind());
        Assertions.assertTrue(observation.evidence().startsWith("Do you want to proceed?"));
        Assertions.assertTrue(observation.evidence().contains("2. No"));
    }

    @Test
    void spinnerIsActive() {
        Assertions.assertEquals(ObservationKind.ACTIVE, classifier.classify("✻ Thinking… (esc to interrupt)").kind());
    }

    @Test
    void completionAndErrorMarkers() {
        Observation done = classifier.classify("all good\nTASK COMPLETE\n> ");
        Assertions.assertEquals(ObservationKind.REPORTED_DONE, done.kind());
        Assertions.assertEquals("TASK COMPLETE", done.evidence());

        Observation failed = classifier.classify("TASK FAILED: tests red\n> ");
        Assertions.assertEquals(ObservationKind.REPORTED_ERROR, failed.kind());
        Assertions.assertEquals("TASK FAILED: tests red", failed.evidence());
    }

    @Test
    void promptTakesPrecedenceOverCompletion() {
        String pane = "TASK COMPLETE\nAllow write to /tmp/out?\n";
        Assertions.assertEquals(ObservationKind.BLOCKED, classifier.classify(pane).kind());
    }

    @Test
    void emptyInputLineIsIdleAndNoiseIsUnknown() {
        Assertions.assertEquals(ObservationKind.IDLE, classifier.classify("done editing\n>\n").kind());
        Assertions.assertEquals(ObservationKind.UNKNOWN, classifier.classify("lorem ipsum").kind());
        Assertions.assertEquals(ObservationKind.UNKNOWN, classifier.classify(null).kind());
    }

    @Test
    void promptScrolledAboveTailIsIgnored() {
        StringBuilder pane = new StringBuilder("Do you want to proceed?\n");
        for (int i = 0; i < OutputClassifier.TAIL_LINES; i++) {
            pane.append("line ").append(i).append('\n');
        }
        Assertions.assertNotEquals(ObservationKind.BLOCKED, classifier.classify(pane.toString()).kind());
    }

    @Test
    void sinceDeliveryDropsMarkersFromEarlierTask() {
        String pane = "TASK COMPLETE\n> fix the flaky login test\nlooking at tests\n";
        String since = OutputClassifier.sinceDelivery(pane, "fix the flaky login test");
        Assertions.assertEquals("looking at tests\n", since);
        Assertions.assertEquals(ObservationKind.UNKNOWN, classifier.classify(since).kind());
    }

    @Test
    void markersAreIgnoredWhenEchoScrolledAway() {
        String pane = "fix bug A\nTASK COMPLETE\n> ";
        Assertions.assertNull(OutputClassifier.sinceDelivery(pane, "something else entirely"));
        Assertions.assertEquals(ObservationKind.IDLE, classifier.classifyForTask(pane, "something else entirely").kind());
        Assertions.assertEquals(ObservationKind.ACTIVE,
                classifier.classifyForTask("TASK FAILED: old\n✻ Thinking…", "write the docs").kind());
    }

    @Test
    void pastePlaceholderAnchorsLongTasks() {
        String task = "write the docs for module B\nsection one\nsection two";
        String before = "fix bug A\nTASK COMPLETE\n> [Pasted text #1 +3 lines]";
        Assertions.assertEquals(ObservationKind.UNKNOWN, classifier.classifyForTask(before, task).kind());

        String after = before + "\nwrote docs/module-b.md\nTASK COMPLETE\n> ";
        Observation done = classifier.classifyForTask(after, task);
        Assertions.assertEquals(ObservationKind.REPORTED_DONE, done.kind());
        Assertions.assertEquals("TASK COMPLETE", done.evidence());
    }
}
