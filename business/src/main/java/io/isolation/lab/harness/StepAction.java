package io.isolation.lab.harness;

public enum StepAction {
    BEGIN,
    READ,
    COUNT,
    UPDATE,
    INSERT,
    SLEEP,
    COMMIT,
    ROLLBACK
}
