package io.isolation.lab.api.scenario;

import io.isolation.lab.harness.AnomalyScenario;
import io.isolation.lab.harness.Verdict;
import io.isolation.lab.harness.catalog.AnomalyScenarioCatalog;
import io.isolation.lab.harness.usecase.ScenarioOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point shared by the HTTP and command-line surfaces. Runs are serialised because
 * every scenario resets and mutates the same table.
 */
@Service
public class ScenarioService {

    private static final Logger log = LoggerFactory.getLogger(ScenarioService.class);

    private final ScenarioOrchestrator scenarioOrchestrator;

    public ScenarioService(ScenarioOrchestrator scenarioOrchestrator) {
        this.scenarioOrchestrator = Objects.requireNonNull(scenarioOrchestrator);
    }

    public List<AnomalyScenario> scenarios() {
        return AnomalyScenarioCatalog.scenarios();
    }

    public List<String> names() {
        return AnomalyScenarioCatalog.names();
    }

    public synchronized Optional<Verdict> run(String name) {
        var scenario = AnomalyScenarioCatalog.find(name);
        if (scenario.isEmpty()) {
            log.warn("Unknown scenario requested: {}", name);
        }
        return scenario.map(scenarioOrchestrator::run);
    }
}
