package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * One entry of a scenario's global step order. Only the payload fields relevant to
 * {@link #action()} are set; the others stay {@code null}.
 */
public record ScenarioStep(
    String actor,
    StepAction action,
    Long rowId,
    BigDecimal delta,
    ItemPredicate predicate,
    Item row,
    Duration duration,
    boolean fatal
) {
    public ScenarioStep {
        Objects.requireNonNull(actor, "actor cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        switch (action) {
            case READ -> Objects.requireNonNull(rowId, "READ needs a rowId");
            case COUNT -> Objects.requireNonNull(predicate, "COUNT needs a predicate");
            case UPDATE -> {
                Objects.requireNonNull(rowId, "UPDATE needs a rowId");
                Objects.requireNonNull(delta, "UPDATE needs a delta");
            }
            case INSERT -> Objects.requireNonNull(row, "INSERT needs a row");
            case SLEEP -> {
                Objects.requireNonNull(duration, "SLEEP needs a duration");
                if (duration.isNegative()) throw new IllegalArgumentException("duration cannot be negative");
            }
            default -> { }
        }
    }

    public static ScenarioStep begin(String actor) {
        return of(actor, StepAction.BEGIN);
    }

    public static ScenarioStep read(String actor, long rowId) {
        return new ScenarioStep(actor, StepAction.READ, rowId, null, null, null, null, false);
    }

    public static ScenarioStep count(String actor, ItemPredicate predicate) {
        return new ScenarioStep(actor, StepAction.COUNT, null, null, predicate, null, null, false);
    }

    public static ScenarioStep update(String actor, long rowId, String delta) {
        return new ScenarioStep(actor, StepAction.UPDATE, rowId, new BigDecimal(delta), null, null, null, false);
    }

    public static ScenarioStep insert(String actor, Item row) {
        return new ScenarioStep(actor, StepAction.INSERT, null, null, null, row, null, false);
    }

    /** Marks the actor's transaction as held open while other actors proceed. */
    public static ScenarioStep sleep(String actor) {
        return sleep(actor, Duration.ZERO);
    }

    public static ScenarioStep sleep(String actor, Duration duration) {
        return new ScenarioStep(actor, StepAction.SLEEP, null, null, null, null, duration, false);
    }

    public static ScenarioStep commit(String actor) {
        return of(actor, StepAction.COMMIT);
    }

    public static ScenarioStep rollback(String actor) {
        return of(actor, StepAction.ROLLBACK);
    }

    private static ScenarioStep of(String actor, StepAction action) {
        return new ScenarioStep(actor, action, null, null, null, null, null, false);
    }

    /** A fatal step aborts the run even when it fails with a recoverable error. */
    public ScenarioStep asFatal() {
        return new ScenarioStep(actor, action, rowId, delta, predicate, row, duration, true);
    }

    public String describe() {
        return switch (action) {
            case READ -> "READ item " + rowId;
            case COUNT -> "COUNT " + predicate;
            case UPDATE -> "UPDATE item " + rowId + " price += " + delta.toPlainString();
            case INSERT -> "INSERT item " + row.id() + " '" + row.name() + "' price " + row.price().toPlainString();
            case SLEEP -> "SLEEP " + duration.toMillis() + "ms";
            default -> action.name();
        };
    }
}
