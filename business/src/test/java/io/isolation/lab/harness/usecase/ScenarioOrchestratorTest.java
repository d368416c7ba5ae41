package io.isolation.lab.harness.usecase;

import io.isolation.lab.harness.ActorSpec;
import io.isolation.lab.harness.AnomalyScenario;
import io.isolation.lab.harness.ErrorKind;
import io.isolation.lab.harness.InMemoryTransactionStore;
import io.isolation.lab.harness.Item;
import io.isolation.lab.harness.LogEntry;
import io.isolation.lab.harness.Outcome;
import io.isolation.lab.harness.ScenarioAssertion;
import io.isolation.lab.harness.ScenarioResult;
import io.isolation.lab.harness.ScenarioStep;
import io.isolation.lab.harness.SerializationFailureException;
import io.isolation.lab.harness.StepAction;
import io.isolation.lab.harness.catalog.AnomalyScenarioCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.isolation.lab.harness.IsolationLevel.READ_COMMITTED;
import static io.isolation.lab.harness.ScenarioStep.begin;
import static io.isolation.lab.harness.ScenarioStep.commit;
import static io.isolation.lab.harness.ScenarioStep.read;
import static io.isolation.lab.harness.ScenarioStep.sleep;
import static io.isolation.lab.harness.ScenarioStep.update;
import static org.assertj.core.api.Assertions.assertThat;

class ScenarioOrchestratorTest {

    private InMemoryTransactionStore store;
    private List<Duration> sleeps;
    private ScenarioOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryTransactionStore();
        sleeps = new ArrayList<>();
        orchestrator = ScenarioOrchestrator.create(store, sleeps::add);
    }

    @Test
    void shouldPassEveryCatalogScenario() {
        for (var scenario : AnomalyScenarioCatalog.scenarios()) {
            var verdict = orchestrator.run(scenario);

            assertThat(verdict.pass()).as(verdict.render()).isTrue();
        }
        assertThat(store.openSessions()).isZero();
        assertThat(store.openTransactions()).isZero();
    }

    @Test
    void shouldObserveNonRepeatableReadUnderReadCommitted() {
        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.NON_REPEATABLE_READ));
        var result = result(verdict.entries(), verdict.finalRows());

        assertThat(result.reads("A")).usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("150.00"), new BigDecimal("151.00"));
        assertThat(result.finalPrice(1)).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo(new BigDecimal("151.00")));
        assertThat(verdict.pass()).isTrue();
    }

    @Test
    void shouldKeepReadsStableUnderRepeatableRead() {
        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.REPEATABLE_READ_NO_ANOMALY));
        var result = result(verdict.entries(), verdict.finalRows());

        assertThat(result.reads("A")).usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("50.00"), new BigDecimal("50.00"));
        assertThat(result.committed("A")).isTrue();
        assertThat(result.finalPrice(100)).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo(new BigDecimal("51.00")));
    }

    @Test
    void shouldObservePhantomUnderReadCommitted() {
        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.PHANTOM_READ));

        assertThat(result(verdict.entries(), verdict.finalRows()).counts("A")).containsExactly(3L, 4L);
        assertThat(verdict.pass()).isTrue();
    }

    @Test
    void shouldNeverExposeUncommittedWrite() {
        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.DIRTY_READ));
        var result = result(verdict.entries(), verdict.finalRows());

        assertThat(result.read("B", 0)).isEqualByComparingTo(new BigDecimal("150.00"));
        assertThat(result.finalPrice(1)).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo(new BigDecimal("150.00")));
        assertThat(verdict.pass()).isTrue();
    }

    @Test
    void shouldKeepCountsStableUnderSerializable() {
        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.SERIALIZABLE_NO_PHANTOM));
        var result = result(verdict.entries(), verdict.finalRows());

        assertThat(result.counts("A")).containsExactly(3L, 3L);
        assertThat(result.committed("A")).isTrue();
        assertThat(verdict.pass()).isTrue();
    }

    @Test
    void shouldAcceptSerializationFailureOnCommit() {
        store.failCommit(2, new SerializationFailureException("could not serialize access"));

        var verdict = orchestrator.run(scenario(AnomalyScenarioCatalog.SERIALIZABLE_NO_PHANTOM));

        assertThat(verdict.pass()).as(verdict.render()).isTrue();
        var failedCommit = verdict.entries().get(7);
        assertThat(failedCommit.actor()).isEqualTo("A");
        assertThat(failedCommit.action()).isEqualTo(StepAction.COMMIT);
        assertThat(failedCommit.outcome()).isInstanceOf(Outcome.Failure.class);
        assertThat(((Outcome.Failure) failedCommit.outcome()).kind()).isEqualTo(ErrorKind.SERIALIZATION_FAILURE);
        assertThat(store.openTransactions()).isZero();
    }

    @Test
    void shouldFailWhenStoreLeaksConcurrentCommits() {
        store.disableSnapshots();

        var repeatable = orchestrator.run(scenario(AnomalyScenarioCatalog.REPEATABLE_READ_NO_ANOMALY));
        var serializable = orchestrator.run(scenario(AnomalyScenarioCatalog.SERIALIZABLE_NO_PHANTOM));

        assertThat(repeatable.pass()).isFalse();
        assertThat(repeatable.reason()).contains("A read 50.00 then 51.00");
        assertThat(serializable.pass()).isFalse();
        assertThat(serializable.reason()).contains("A counted 3 then 4 and still committed");
    }

    @Test
    void shouldBeIdempotent() {
        var scenario = scenario(AnomalyScenarioCatalog.NON_REPEATABLE_READ);

        var first = orchestrator.run(scenario);
        var second = orchestrator.run(scenario);

        assertThat(second.pass()).isEqualTo(first.pass()).isTrue();
        assertThat(second.render()).isEqualTo(first.render());
        assertThat(store.resets()).isEqualTo(2);
    }

    @Test
    void shouldAbortOnMisuseAndRollBackActiveActors() {
        var scenario = twoActorScenario(List.of(
            begin("A"),
            update("A", 1, "5"),
            commit("B"),
            commit("A")
        ));

        var verdict = orchestrator.run(scenario);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).startsWith("aborted: step 2 B: COMMIT failed with ACTOR_MISUSE");
        assertThat(verdict.entries()).extracting(LogEntry::detail)
            .containsExactly("BEGIN", "UPDATE item 1 price += 5", "COMMIT", "ROLLBACK (teardown)");
        assertThat(verdict.finalRows()).singleElement()
            .satisfies(item -> assertThat(item.price()).isEqualByComparingTo(new BigDecimal("10.00")));
        assertThat(store.openSessions()).isZero();
        assertThat(store.openTransactions()).isZero();
    }

    @Test
    void shouldAbortOnUndeclaredActor() {
        var scenario = twoActorScenario(List.of(begin("A"), begin("C"), commit("A")));

        var verdict = orchestrator.run(scenario);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).contains("no actor declared for role C");
        assertThat(store.openTransactions()).isZero();
    }

    @Test
    void shouldRecordLockTimeoutAndContinue() {
        var scenario = twoActorScenario(List.of(
            begin("A"),
            update("A", 1, "5"),
            begin("B"),
            update("B", 1, "1"),
            commit("B"),
            commit("A"),
            read("A", 1)
        ));

        var verdict = orchestrator.run(scenario);
        var outcomes = verdict.entries().stream().map(LogEntry::outcome).toList();

        assertThat(outcomes.get(3)).isInstanceOf(Outcome.Failure.class);
        assertThat(((Outcome.Failure) outcomes.get(3)).kind()).isEqualTo(ErrorKind.LOCK_TIMEOUT);
        assertThat(outcomes.get(4)).isInstanceOf(Outcome.Skipped.class);
        assertThat(outcomes.get(5)).isEqualTo(Outcome.done("committed"));
        assertThat(outcomes.get(6)).isInstanceOf(Outcome.Failure.class);
        assertThat(((Outcome.Failure) outcomes.get(6)).kind()).isEqualTo(ErrorKind.ACTOR_MISUSE);
        assertThat(verdict.finalRows().get(0).price()).isEqualByComparingTo(new BigDecimal("15.00"));
    }

    @Test
    void shouldAbortWhenFatalStepFails() {
        var scenario = twoActorScenario(List.of(
            begin("A"),
            update("A", 1, "5"),
            begin("B"),
            update("B", 1, "1").asFatal(),
            commit("A")
        ));

        var verdict = orchestrator.run(scenario);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).contains("LOCK_TIMEOUT");
        assertThat(verdict.entries()).extracting(LogEntry::action)
            .containsExactly(StepAction.BEGIN, StepAction.UPDATE, StepAction.BEGIN, StepAction.UPDATE, StepAction.ROLLBACK);
        assertThat(verdict.finalRows().get(0).price()).isEqualByComparingTo(new BigDecimal("10.00"));
    }

    @Test
    void shouldSleepOnlyForPositiveDurations() {
        var scenario = twoActorScenario(List.of(
            begin("A"),
            sleep("A"),
            sleep("A", Duration.ofMillis(25)),
            commit("A")
        ));

        orchestrator.run(scenario);

        assertThat(sleeps).containsExactly(Duration.ofMillis(25));
    }

    private static AnomalyScenario scenario(String name) {
        return AnomalyScenarioCatalog.find(name).orElseThrow();
    }

    private static AnomalyScenario twoActorScenario(List<ScenarioStep> steps) {
        return new AnomalyScenario(
            "custom",
            "ad-hoc interleaving",
            List.of(Item.of(1, "demo", "10.00")),
            List.of(new ActorSpec("A", READ_COMMITTED), new ActorSpec("B", READ_COMMITTED)),
            steps,
            ScenarioAssertion.of("always holds", result -> { })
        );
    }

    private static ScenarioResult result(List<LogEntry> entries, List<Item> finalRows) {
        return new ScenarioResult("test", entries, finalRows);
    }
}
