package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * The recorded step log of one run plus the committed rows left in the table after teardown.
 */
public record ScenarioResult(
    String scenario,
    List<LogEntry> entries,
    List<Item> finalRows
) {
    public ScenarioResult {
        entries = List.copyOf(entries);
        finalRows = List.copyOf(finalRows);
    }

    public List<BigDecimal> reads(String actor) {
        return values(actor, StepAction.READ, BigDecimal.class);
    }

    public List<Long> counts(String actor) {
        return values(actor, StepAction.COUNT, Long.class);
    }

    public BigDecimal read(String actor, int ordinal) {
        var reads = reads(actor);
        if (reads.size() <= ordinal) {
            throw new AssertionMismatchException(
                "expected at least " + (ordinal + 1) + " reads by " + actor + " but observed " + reads.size());
        }
        return reads.get(ordinal);
    }

    public long count(String actor, int ordinal) {
        var counts = counts(actor);
        if (counts.size() <= ordinal) {
            throw new AssertionMismatchException(
                "expected at least " + (ordinal + 1) + " counts by " + actor + " but observed " + counts.size());
        }
        return counts.get(ordinal);
    }

    public Optional<Outcome> lastOutcome(String actor, StepAction action) {
        Outcome last = null;
        for (var entry : entries) {
            if (entry.actor().equals(actor) && entry.action() == action) {
                last = entry.outcome();
            }
        }
        return Optional.ofNullable(last);
    }

    public boolean committed(String actor) {
        return lastOutcome(actor, StepAction.COMMIT).filter(Outcome.Done.class::isInstance).isPresent();
    }

    public boolean failedWith(String actor, ErrorKind kind) {
        return entries.stream()
            .filter(e -> e.actor().equals(actor))
            .map(LogEntry::outcome)
            .anyMatch(o -> o instanceof Outcome.Failure failure && failure.kind() == kind);
    }

    public Optional<BigDecimal> finalPrice(long itemId) {
        return finalRows.stream()
            .filter(item -> item.id() == itemId)
            .map(Item::price)
            .findFirst();
    }

    private <T> List<T> values(String actor, StepAction action, Class<T> type) {
        return entries.stream()
            .filter(e -> e.actor().equals(actor) && e.action() == action)
            .map(LogEntry::outcome)
            .filter(Outcome.Value.class::isInstance)
            .map(o -> type.cast(((Outcome.Value) o).value()))
            .toList();
    }
}
