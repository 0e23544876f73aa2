package io.taskrelay.model;

public record Directive(
        String directiveId,
        DirectiveType type,
        String content,
        String target,
        Long taskId,
        DirectiveStatus status,
        long issuedAtMs,
        Long acknowledgedAtMs,
        String acknowledgedBy
) {
    public static final String TARGET_ALL = "all";

    public boolean broadcast() {
        return TARGET_ALL.equalsIgnoreCase(target);
    }
}
