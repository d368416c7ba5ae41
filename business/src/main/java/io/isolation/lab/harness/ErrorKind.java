package io.isolation.lab.harness;

public enum ErrorKind {
    STEP_EXECUTION(false),
    SERIALIZATION_FAILURE(true),
    LOCK_TIMEOUT(true),
    ASSERTION_MISMATCH(false),
    ACTOR_MISUSE(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Recoverable kinds are store behaviour under test and are recorded as data;
     * the others abort the run.
     */
    public boolean recoverable() {
        return recoverable;
    }
}
