package io.isolation.lab.harness;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of one demonstration: the rows to seed, the actors and their
 * isolation levels, the global step order and the expectation over the recorded log.
 */
public record AnomalyScenario(
    String name,
    String description,
    List<Item> initialFixture,
    List<ActorSpec> actors,
    List<ScenarioStep> steps,
    ScenarioAssertion assertion
) {
    public AnomalyScenario {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(assertion, "assertion cannot be null");
        initialFixture = List.copyOf(initialFixture);
        actors = List.copyOf(actors);
        steps = List.copyOf(steps);
        if (actors.isEmpty()) throw new IllegalArgumentException("actors cannot be empty");
        if (steps.isEmpty()) throw new IllegalArgumentException("steps cannot be empty");
        var roles = new HashSet<String>();
        for (var actor : actors) {
            if (!roles.add(actor.role())) {
                throw new IllegalArgumentException("duplicate actor role: " + actor.role());
            }
        }
    }

    public Optional<ActorSpec> actor(String role) {
        return actors.stream().filter(a -> a.role().equals(role)).findFirst();
    }
}
