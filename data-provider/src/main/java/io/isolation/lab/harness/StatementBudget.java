package io.isolation.lab.harness;

import java.time.Duration;
import java.util.Objects;

/**
 * Upper bounds applied to every statement an actor issues, so a blocked writer fails
 * instead of hanging the run.
 */
public record StatementBudget(Duration statementTimeout, Duration lockTimeout) {

    public StatementBudget {
        Objects.requireNonNull(statementTimeout, "statementTimeout cannot be null");
        Objects.requireNonNull(lockTimeout, "lockTimeout cannot be null");
        if (statementTimeout.isNegative() || statementTimeout.isZero())
            throw new IllegalArgumentException("statementTimeout must be positive");
        if (lockTimeout.isNegative() || lockTimeout.isZero())
            throw new IllegalArgumentException("lockTimeout must be positive");
    }
}
