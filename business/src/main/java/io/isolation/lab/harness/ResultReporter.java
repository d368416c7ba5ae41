package io.isolation.lab.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of one run. Entries are never rewritten once recorded.
 */
public final class ResultReporter {

    private final String scenario;
    private final List<LogEntry> entries = new ArrayList<>();

    public ResultReporter(String scenario) {
        this.scenario = Objects.requireNonNull(scenario, "scenario cannot be null");
    }

    public void record(int stepIndex, String actor, StepAction action, Outcome outcome) {
        record(stepIndex, actor, action, action.name(), outcome);
    }

    public void record(int stepIndex, ScenarioStep step, Outcome outcome) {
        record(stepIndex, step.actor(), step.action(), step.describe(), outcome);
    }

    public void record(int stepIndex, String actor, StepAction action, String detail, Outcome outcome) {
        entries.add(new LogEntry(stepIndex, actor, action, detail, outcome));
    }

    public List<LogEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Verdict finalizeVerdict(ScenarioAssertion assertion, List<Item> finalRows) {
        var result = new ScenarioResult(scenario, entries, finalRows);
        try {
            assertion.verify(result);
            return new Verdict(scenario, true, assertion.description(), null, entries, finalRows);
        } catch (AssertionMismatchException e) {
            return new Verdict(scenario, false, assertion.description(), e.getMessage(), entries, finalRows);
        }
    }

    public Verdict abort(ScenarioAssertion assertion, String reason, List<Item> finalRows) {
        return new Verdict(scenario, false, assertion.description(), "aborted: " + reason, entries, finalRows);
    }
}
