package io.taskrelay.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Argument vectors for the tmux operations a worker session needs.
 */
public final class TmuxCommands {
    /** Key names tmux interprets instead of typing literally. */
    private static final Set<String> NAMED_KEYS = Set.of(
            "Enter", "Escape", "Tab", "BSpace", "Up", "Down", "Left", "Right", "C-c", "C-d", "C-u", "C-l"
    );

    private TmuxCommands() {
    }

    public static List<String> sendLiteral(String session, String text) {
        return List.of("tmux", "send-keys", "-t", session, "-l", "--", text);
    }

    public static List<String> sendKeys(String session, List<String> keys) {
        List<String> out = new ArrayList<>(List.of("tmux", "send-keys", "-t", session));
        out.addAll(keys);
        return out;
    }

    public static List<String> capture(String session, int lines) {
        return List.of("tmux", "capture-pane", "-p", "-J", "-t", session, "-S", "-" + Math.max(1, lines));
    }

    public static boolean isNamedKey(String key) {
        return NAMED_KEYS.contains(key);
    }
}
