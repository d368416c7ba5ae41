package io.isolation.lab.harness.usecase;

import io.isolation.lab.harness.AnomalyScenario;
import io.isolation.lab.harness.Sleeper;
import io.isolation.lab.harness.TransactionStore;
import io.isolation.lab.harness.Verdict;

/**
 * Runs a scenario as the only scheduler: steps reach the store strictly in declared order,
 * so two transactions can be open at once while their interleaving stays reproducible.
 */
public sealed interface ScenarioOrchestrator permits ScenarioOrchestratorImpl {

    static ScenarioOrchestrator create(TransactionStore store) {
        return create(store, Sleeper.system());
    }

    static ScenarioOrchestrator create(TransactionStore store, Sleeper sleeper) {
        return new ScenarioOrchestratorImpl(store, sleeper);
    }

    Verdict run(AnomalyScenario scenario);
}
