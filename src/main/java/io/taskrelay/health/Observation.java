package io.taskrelay.health;

/**
 * One classified look at a worker's pane. {@code evidence} is the text that decided
 * the kind (the prompt block for {@link ObservationKind#BLOCKED}).
 */
public record Observation(
        ObservationKind kind,
        String evidence
) {
    public static Observation of(ObservationKind kind) {
        return new Observation(kind, null);
    }
}
