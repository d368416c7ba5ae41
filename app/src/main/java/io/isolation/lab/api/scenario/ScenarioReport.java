package io.isolation.lab.api.scenario;

import io.isolation.lab.harness.Item;
import io.isolation.lab.harness.LogEntry;
import io.isolation.lab.harness.Outcome;
import io.isolation.lab.harness.Verdict;

import java.util.List;

public record ScenarioReport(
    String scenario,
    String verdict,
    String assertion,
    String reason,
    List<StepReport> steps,
    List<RowReport> finalRows,
    String rendered
) {
    public static ScenarioReport from(Verdict verdict) {
        return new ScenarioReport(
            verdict.scenario(),
            verdict.pass() ? "PASS" : "FAIL",
            verdict.assertion(),
            verdict.reason(),
            verdict.entries().stream().map(StepReport::from).toList(),
            verdict.finalRows().stream().map(RowReport::from).toList(),
            verdict.render()
        );
    }

    public record StepReport(
        int index,
        String actor,
        String action,
        String detail,
        String outcome,
        String errorKind
    ) {
        static StepReport from(LogEntry entry) {
            var errorKind = entry.outcome() instanceof Outcome.Failure failure ? failure.kind().name() : null;
            return new StepReport(
                entry.stepIndex(),
                entry.actor(),
                entry.action().name(),
                entry.detail(),
                entry.outcome().render(),
                errorKind
            );
        }
    }

    public record RowReport(long id, String name, String price, boolean deleted) {
        static RowReport from(Item item) {
            return new RowReport(item.id(), item.name(), item.price().toPlainString(), item.deleted());
        }
    }
}
