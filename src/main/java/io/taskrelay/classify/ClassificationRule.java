package io.taskrelay.classify;

import io.taskrelay.model.WorkType;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One ordered classifier rule. {@code prefixPattern} is matched at the start of the
 * trimmed description, case-insensitively.
 */
public record ClassificationRule(String prefixPattern, WorkType workType, int basePriority) {

    public ClassificationRule {
        if (prefixPattern == null || prefixPattern.isBlank()) {
            throw new IllegalArgumentException("classifier rule pattern must not be blank");
        }
        if (workType == null) {
            throw new IllegalArgumentException("classifier rule work type is required: " + prefixPattern);
        }
        try {
            Pattern.compile(prefixPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid classifier pattern: " + prefixPattern, e);
        }
    }

    Pattern compile() {
        return Pattern.compile("^(?:" + prefixPattern + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
