package io.taskrelay.model;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public enum WorkType {
    DEVELOPMENT,
    DEPLOYMENT,
    REVIEW,
    TEST,
    MONITORING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEVELOPMENT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (WorkType value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown work type: " + raw);
    }

    /**
     * Parses a comma separated affinity list. Blank or {@code *} means every work type.
     */
    public static Set<WorkType> parseAffinity(String raw) {
        if (raw == null || raw.isBlank() || "*".equals(raw.trim())) {
            return EnumSet.allOf(WorkType.class);
        }
        Set<WorkType> out = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(fromString(part));
            }
        }
        return out.isEmpty() ? EnumSet.allOf(WorkType.class) : EnumSet.copyOf(out);
    }

    public static String formatAffinity(Set<WorkType> affinity) {
        StringBuilder sb = new StringBuilder();
        for (WorkType type : values()) {
            if (affinity.contains(type)) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(type.wireName());
            }
        }
        return sb.toString();
    }
}
