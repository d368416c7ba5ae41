package io.isolation.lab.harness;

import java.util.List;
import java.util.stream.Collectors;

public record Verdict(
    String scenario,
    boolean pass,
    String assertion,
    String reason,
    List<LogEntry> entries,
    List<Item> finalRows
) {
    public Verdict {
        entries = List.copyOf(entries);
        finalRows = List.copyOf(finalRows);
    }

    public String verdictLine() {
        var line = "VERDICT: " + (pass ? "PASS" : "FAIL") + " - " + assertion;
        return reason == null ? line : line + " (" + reason + ")";
    }

    public String render() {
        var steps = entries.stream().map(LogEntry::render).collect(Collectors.joining(System.lineSeparator()));
        return steps.isEmpty() ? verdictLine() : steps + System.lineSeparator() + verdictLine();
    }
}
