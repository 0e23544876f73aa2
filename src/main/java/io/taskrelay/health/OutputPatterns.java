package io.taskrelay.health;

import java.util.List;

/**
 * Regex lists used to classify captured pane output. Patterns are compiled
 * case-sensitive with {@code MULTILINE}; prefix a pattern with {@code (?i)} to relax case.
 */
public record OutputPatterns(
        List<String> blocked,
        List<String> active,
        List<String> done,
        List<String> error,
        List<String> idle
) {
    public OutputPatterns {
        blocked = blocked == null ? List.of() : List.copyOf(blocked);
        active = active == null ? List.of() : List.copyOf(active);
        done = done == null ? List.of() : List.copyOf(done);
        error = error == null ? List.of() : List.copyOf(error);
        idle = idle == null ? List.of() : List.copyOf(idle);
    }

    public static OutputPatterns defaults() {
        return new OutputPatterns(
                List.of(
                        "Do you want to (?:proceed|make this edit|create|run|allow)",
                        "want to proceed\\?",
                        "\\(y/n\\)",
                        "\\[Y/n\\]",
                        "^\\s*(?:❯\\s*)?1\\.\\s*Yes",
                        "^\\s*Allow [^\\n]+\\?",
                        "Press Enter to continue"
                ),
                List.of(
                        "(?i)thinking",
                        "Running",
                        "Analyzing",
                        "Processing",
                        "Executing",
                        "Working",
                        "Building",
                        "Compiling",
                        "Searching",
                        "Reading",
                        "Writing",
                        "esc to interrupt",
                        "\\[\\d+/\\d+\\]"
                ),
                List.of(
                        "^\\s*(?:TASK COMPLETE|TASK_COMPLETE|✓ Task complete(?:d)?)\\b"
                ),
                List.of(
                        "^\\s*(?:TASK FAILED|TASK_FAILED|✗ Task failed)\\b",
                        "^\\s*API Error:"
                ),
                List.of(
                        "^\\s*[>❯]\\s*$",
                        "\\? for shortcuts",
                        "^\\s*(?:claude|codex|worker)>\\s*$",
                        "How can I help",
                        "What would you like"
                )
        );
    }
}
