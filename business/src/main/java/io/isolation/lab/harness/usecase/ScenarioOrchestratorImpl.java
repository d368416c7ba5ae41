package io.isolation.lab.harness.usecase;

import io.isolation.lab.harness.ActorMisuseException;
import io.isolation.lab.harness.ActorState;
import io.isolation.lab.harness.AnomalyScenario;
import io.isolation.lab.harness.HarnessException;
import io.isolation.lab.harness.Outcome;
import io.isolation.lab.harness.ResultReporter;
import io.isolation.lab.harness.ScenarioStep;
import io.isolation.lab.harness.Sleeper;
import io.isolation.lab.harness.StepAction;
import io.isolation.lab.harness.TransactionActor;
import io.isolation.lab.harness.TransactionStore;
import io.isolation.lab.harness.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

record ScenarioOrchestratorImpl(
    TransactionStore store,
    Sleeper sleeper
) implements ScenarioOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioOrchestratorImpl.class);

    ScenarioOrchestratorImpl {
        Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    @Override
    public Verdict run(AnomalyScenario scenario) {
        log.info("Running scenario {} with actors {}", scenario.name(), scenario.actors());
        store.resetFixture(scenario.initialFixture());

        var reporter = new ResultReporter(scenario.name());
        var actors = new LinkedHashMap<String, TransactionActor>();
        Optional<String> abortReason;
        try {
            for (var spec : scenario.actors()) {
                actors.put(spec.role(),
                    new TransactionActor(spec.role(), spec.isolationLevel(), store.openSession(), sleeper));
            }
            abortReason = executeSteps(scenario, actors, reporter);
        } finally {
            tearDown(actors, reporter, scenario.steps().size());
        }

        var finalRows = store.committedRows();
        var verdict = abortReason
            .map(reason -> reporter.abort(scenario.assertion(), reason, finalRows))
            .orElseGet(() -> reporter.finalizeVerdict(scenario.assertion(), finalRows));
        log.info("Scenario {} finished: {}", scenario.name(), verdict.verdictLine());
        return verdict;
    }

    private Optional<String> executeSteps(AnomalyScenario scenario,
                                          Map<String, TransactionActor> actors,
                                          ResultReporter reporter) {
        var steps = scenario.steps();
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            var actor = actors.get(step.actor());
            if (actor == null) {
                var misuse = new ActorMisuseException("no actor declared for role " + step.actor());
                reporter.record(i, step, Outcome.failure(misuse));
                return Optional.of(abortMessage(i, step, misuse));
            }
            if (actor.state() == ActorState.FAILED) {
                reporter.record(i, step, Outcome.skipped(actor.role() + " already failed"));
                continue;
            }
            try {
                var outcome = dispatch(actor, step);
                log.debug("step {} {}: {} -> {}", i, step.actor(), step.describe(), outcome.render());
                reporter.record(i, step, outcome);
            } catch (HarnessException e) {
                reporter.record(i, step, Outcome.failure(e));
                if (!e.kind().recoverable() || step.fatal()) {
                    log.warn("Scenario {} aborted at step {}: {}", scenario.name(), i, e.getMessage());
                    return Optional.of(abortMessage(i, step, e));
                }
                log.warn("Step {} ({}: {}) failed with {}, continuing: {}",
                    i, step.actor(), step.describe(), e.kind(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Outcome dispatch(TransactionActor actor, ScenarioStep step) {
        return switch (step.action()) {
            case BEGIN -> {
                actor.begin();
                yield Outcome.done("began at " + actor.isolationLevel());
            }
            case READ -> Outcome.value(actor.read(step.rowId()));
            case COUNT -> Outcome.value(actor.count(step.predicate()));
            case UPDATE -> {
                actor.update(step.rowId(), step.delta());
                yield Outcome.done("updated, not yet committed");
            }
            case INSERT -> {
                actor.insert(step.row());
                yield Outcome.done("inserted, not yet committed");
            }
            case SLEEP -> {
                actor.sleep(step.duration());
                yield Outcome.done("transaction held open");
            }
            case COMMIT -> {
                actor.commit();
                yield Outcome.done("committed");
            }
            case ROLLBACK -> {
                actor.rollback();
                yield Outcome.done("rolled back");
            }
        };
    }

    private void tearDown(Map<String, TransactionActor> actors, ResultReporter reporter, int nextIndex) {
        int index = nextIndex;
        for (var actor : actors.values()) {
            try {
                if (actor.state() == ActorState.ACTIVE) {
                    actor.rollback();
                    reporter.record(index++, actor.role(), StepAction.ROLLBACK, "ROLLBACK (teardown)",
                        Outcome.done("still active at end of run, rolled back"));
                }
            } finally {
                release(actor);
            }
        }
    }

    private void release(TransactionActor actor) {
        try {
            actor.close();
        } catch (HarnessException e) {
            log.warn("Failed to release session of {}: {}", actor.role(), e.getMessage());
        }
    }

    private static String abortMessage(int index, ScenarioStep step, HarnessException e) {
        return "step " + index + " " + step.actor() + ": " + step.describe() + " failed with " + e.kind()
            + ": " + e.getMessage();
    }
}
