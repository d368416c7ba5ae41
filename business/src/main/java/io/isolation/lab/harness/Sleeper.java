package io.isolation.lab.harness;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper system() {
        return duration -> {
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException("interrupted while sleeping", e);
            }
        };
    }
}
