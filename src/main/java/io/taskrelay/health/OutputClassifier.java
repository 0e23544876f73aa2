package io.taskrelay.health;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies captured pane text. Prompts, spinners and the input line live at the
 * bottom of the pane, so blocked/active/idle are matched against the last few
 * non-blank lines only; completion and error markers anywhere in the given text.
 * Precedence: blocked, error, done, active, idle.
 */
public final class OutputClassifier {
    static final int TAIL_LINES = 12;
    private static final int ANCHOR_CHARS = 40;
    private static final Pattern PASTE_PLACEHOLDER = Pattern.compile("\\[Pasted text #\\d+[^\\]\n]*\\]");

    private final List<Pattern> blocked;
    private final List<Pattern> active;
    private final List<Pattern> done;
    private final List<Pattern> error;
    private final List<Pattern> idle;

    public OutputClassifier(OutputPatterns patterns) {
        this.blocked = compile(patterns.blocked());
        this.active = compile(patterns.active());
        this.done = compile(patterns.done());
        this.error = compile(patterns.error());
        this.idle = compile(patterns.idle());
    }

    public Observation classify(String output) {
        return classify(output, true);
    }

    /**
     * Classifies only what the worker printed after the task was delivered. When
     * neither the task echo nor a paste placeholder is on screen, completion and
     * error markers cannot be tied to this task and are ignored.
     */
    public Observation classifyForTask(String output, String taskContent) {
        String fresh = sinceDelivery(output, taskContent);
        return fresh == null ? classify(output, false) : classify(fresh, true);
    }

    private Observation classify(String output, boolean markers) {
        String text = output == null ? "" : output.replace("\r", "");
        String tail = tail(text, TAIL_LINES);
        Matcher prompt = firstMatch(blocked, tail);
        if (prompt != null) {
            return new Observation(ObservationKind.BLOCKED, promptBlock(tail, prompt.start()));
        }
        if (markers) {
            Matcher failed = firstMatch(error, text);
            if (failed != null) {
                return new Observation(ObservationKind.REPORTED_ERROR, lineAt(text, failed.start()));
            }
            Matcher finished = firstMatch(done, text);
            if (finished != null) {
                return new Observation(ObservationKind.REPORTED_DONE, lineAt(text, finished.start()));
            }
        }
        if (firstMatch(active, tail) != null) {
            return Observation.of(ObservationKind.ACTIVE);
        }
        if (firstMatch(idle, tail) != null) {
            return Observation.of(ObservationKind.IDLE);
        }
        return Observation.of(ObservationKind.UNKNOWN);
    }

    /**
     * Drops everything up to the last echo of the delivered task, so markers left on
     * screen by an earlier task are not read as this task's outcome. Long text shows
     * up as a paste placeholder instead of its first line; the last placeholder is
     * used then. Returns null when neither is in the capture.
     */
    public static String sinceDelivery(String output, String taskContent) {
        if (output == null || taskContent == null) {
            return null;
        }
        String anchor = null;
        for (String line : taskContent.split("\n")) {
            if (!line.isBlank()) {
                anchor = line.strip();
                break;
            }
        }
        int at = -1;
        if (anchor != null) {
            if (anchor.length() > ANCHOR_CHARS) {
                anchor = anchor.substring(0, ANCHOR_CHARS);
            }
            at = output.lastIndexOf(anchor);
        }
        Matcher paste = PASTE_PLACEHOLDER.matcher(output);
        while (paste.find()) {
            at = Math.max(at, paste.start());
        }
        if (at < 0) {
            return null;
        }
        int lineEnd = output.indexOf('\n', at);
        return lineEnd < 0 ? "" : output.substring(lineEnd + 1);
    }

    static String tail(String text, int lines) {
        String[] all = text.split("\n");
        List<String> kept = new ArrayList<>();
        for (int i = all.length - 1; i >= 0 && kept.size() < lines; i--) {
            if (!all[i].isBlank()) {
                kept.add(0, all[i]);
            }
        }
        return String.join("\n", kept);
    }

    private static String promptBlock(String tail, int matchStart) {
        int lineStart = tail.lastIndexOf('\n', matchStart) + 1;
        return tail.substring(lineStart);
    }

    private static String lineAt(String text, int index) {
        int start = text.lastIndexOf('\n', index) + 1;
        int end = text.indexOf('\n', index);
        return (end < 0 ? text.substring(start) : text.substring(start, end)).strip();
    }

    private static Matcher firstMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return m;
            }
        }
        return null;
    }

    private static List<Pattern> compile(List<String> raw) {
        List<Pattern> out = new ArrayList<>();
        for (String r : raw) {
            try {
                out.add(Pattern.compile(r, Pattern.MULTILINE));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid output pattern: " + r, e);
            }
        }
        return List.copyOf(out);
    }
}
