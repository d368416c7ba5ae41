package io.isolation.lab.harness;

public enum ActorState {
    NOT_STARTED,
    ACTIVE,
    COMMITTED,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }
}
