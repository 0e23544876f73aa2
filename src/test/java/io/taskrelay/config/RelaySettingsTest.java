package io.taskrelay.config;

import io.taskrelay.model.WorkType;
import io.taskrelay.testing.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class RelaySettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = TestRoots.create("settings-defaults");
        try {
            RelaySettings settings = RelaySettings.load(root.resolve(TaskRelayConfig.SETTINGS_FILE));
            Assertions.assertEquals(RelaySettings.defaults(), settings);
            Assertions.assertEquals(15_000L, settings.blockedCooldownMs());
            Assertions.assertEquals(30, settings.defaultTimeoutMinutes());
            Assertions.assertEquals(3, settings.defaultMaxRetries());
            Assertions.assertEquals("1", settings.correctiveResponse());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesAreMergedAndClamped() throws Exception {
        Path root = TestRoots.create("settings-file");
        try {
            Path file = root.resolve(TaskRelayConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "lockTtlMs": 10,
                      "defaultMaxRetries": 5,
                      "blockedCooldownMs": 20000,
                      "correctiveResponse": "y",
                      "completeOnIdle": true,
                      "unknownKey": "ignored",
                      "classifierRules": [
                        {"pattern": "docs?\\\\b", "workType": "review", "priority": 15}
                      ],
                      "donePatterns": ["^ALL DONE$"]
                    }
                    """, StandardCharsets.UTF_8);
            RelaySettings settings = RelaySettings.load(file);
            Assertions.assertEquals(1_000L, settings.lockTtlMs());
            Assertions.assertEquals(5, settings.defaultMaxRetries());
            Assertions.assertEquals(20_000L, settings.blockedCooldownMs());
            Assertions.assertEquals("y", settings.correctiveResponse());
            Assertions.assertTrue(settings.completeOnIdle());
            Assertions.assertEquals(1, settings.classifierRules().size());
            Assertions.assertEquals(WorkType.REVIEW, settings.classifierRules().get(0).workType());
            Assertions.assertEquals(List.of("^ALL DONE$"), settings.outputPatterns().done());
            Assertions.assertEquals(RelaySettings.defaults().outputPatterns().blocked(), settings.outputPatterns().blocked());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileIsRejected() throws Exception {
        Path root = TestRoots.create("settings-bad");
        try {
            Path file = root.resolve(TaskRelayConfig.SETTINGS_FILE);
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> RelaySettings.load(file));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }
}
