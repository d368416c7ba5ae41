package io.isolation.lab.api.scenario;

import io.isolation.lab.harness.AnomalyScenario;

import java.util.List;

public record ScenarioSummary(
    String name,
    String description,
    List<String> actors,
    int steps
) {
    public static ScenarioSummary from(AnomalyScenario scenario) {
        var actors = scenario.actors().stream()
            .map(a -> a.role() + " @ " + a.isolationLevel())
            .toList();
        return new ScenarioSummary(scenario.name(), scenario.description(), actors, scenario.steps().size());
    }
}
