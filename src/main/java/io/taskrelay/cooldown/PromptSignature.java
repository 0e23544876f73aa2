package io.taskrelay.cooldown;

import io.taskrelay.util.Hashing;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable key for a confirmation prompt, so the same prompt redrawn with a spinner,
 * counter or different box width maps to the same cooldown entry.
 */
public final class PromptSignature {
    private static final Pattern ANSI = Pattern.compile("\\u001B\\[[0-9;?]*[ -/]*[@-~]|\\u001B[@-Z\\\\-_]");
    private static final Pattern BOX_GLYPHS = Pattern.compile("[\\u2500-\\u259F\\u2800-\\u28FF]");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PromptSignature() {
    }

    public static String normalize(String prompt) {
        if (prompt == null) {
            return "";
        }
        String out = ANSI.matcher(prompt).replaceAll("");
        out = BOX_GLYPHS.matcher(out).replaceAll("");
        out = DIGITS.matcher(out).replaceAll("");
        out = WHITESPACE.matcher(out).replaceAll("");
        return out.toLowerCase(Locale.ROOT);
    }

    public static String key(String prompt) {
        return Hashing.sha256Hex(normalize(prompt)).substring(0, 32);
    }
}
