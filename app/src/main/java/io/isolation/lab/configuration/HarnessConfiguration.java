package io.isolation.lab.configuration;

import io.isolation.lab.harness.StatementBudget;
import io.isolation.lab.harness.TransactionStore;
import io.isolation.lab.harness.usecase.ScenarioOrchestrator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HarnessConfiguration {

    @Bean
    public StatementBudget statementBudget(HarnessProperties properties) {
        return new StatementBudget(properties.statementTimeout(), properties.lockTimeout());
    }

    @Bean
    public ScenarioOrchestrator scenarioOrchestrator(TransactionStore transactionStore) {
        return ScenarioOrchestrator.create(transactionStore);
    }
}
