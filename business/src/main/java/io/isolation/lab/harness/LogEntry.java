package io.isolation.lab.harness;

import java.util.Objects;

public record LogEntry(
    int stepIndex,
    String actor,
    StepAction action,
    String detail,
    Outcome outcome
) {
    public LogEntry {
        Objects.requireNonNull(actor);
        Objects.requireNonNull(action);
        Objects.requireNonNull(detail);
        Objects.requireNonNull(outcome);
    }

    public String render() {
        return actor + ": " + detail + " -> " + outcome.render();
    }
}
