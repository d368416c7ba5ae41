package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * What a single step produced: an observed value, a plain acknowledgement,
 * a typed failure, or nothing because the step was skipped.
 */
public sealed interface Outcome {

    static Outcome value(Object value) {
        return new Value(value);
    }

    static Outcome done(String note) {
        return new Done(note);
    }

    static Outcome failure(HarnessException e) {
        return new Failure(e.kind(), e.getMessage());
    }

    static Outcome skipped(String reason) {
        return new Skipped(reason);
    }

    String render();

    record Value(Object value) implements Outcome {
        public Value {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String render() {
            return value instanceof BigDecimal decimal ? decimal.toPlainString() : String.valueOf(value);
        }
    }

    record Done(String note) implements Outcome {
        @Override
        public String render() {
            return note;
        }
    }

    record Failure(ErrorKind kind, String message) implements Outcome {
        @Override
        public String render() {
            return kind + ": " + message;
        }
    }

    record Skipped(String reason) implements Outcome {
        @Override
        public String render() {
            return "skipped (" + reason + ")";
        }
    }
}
