package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expectation evaluated against a finished run. {@link #verify} throws
 * {@link AssertionMismatchException} when the observed log violates it.
 */
public interface ScenarioAssertion {

    String description();

    void verify(ScenarioResult result);

    static ScenarioAssertion of(String description, Consumer<ScenarioResult> check) {
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(check, "check cannot be null");
        return new ScenarioAssertion() {
            @Override
            public String description() {
                return description;
            }

            @Override
            public void verify(ScenarioResult result) {
                check.accept(result);
            }
        };
    }

    static void expect(boolean condition, String message) {
        if (!condition) {
            throw new AssertionMismatchException(message);
        }
    }

    static void expectPrice(BigDecimal observed, String expected, String what) {
        expect(observed.compareTo(new BigDecimal(expected)) == 0,
            what + " expected " + expected + " but was " + observed.toPlainString());
    }
}
