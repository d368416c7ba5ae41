package io.isolation.lab.harness.catalog;

import io.isolation.lab.harness.ActorSpec;
import io.isolation.lab.harness.AssertionMismatchException;
import io.isolation.lab.harness.AnomalyScenario;
import io.isolation.lab.harness.ErrorKind;
import io.isolation.lab.harness.Item;
import io.isolation.lab.harness.ItemPredicate;
import io.isolation.lab.harness.ScenarioAssertion;
import io.isolation.lab.harness.ScenarioResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static io.isolation.lab.harness.IsolationLevel.READ_COMMITTED;
import static io.isolation.lab.harness.IsolationLevel.REPEATABLE_READ;
import static io.isolation.lab.harness.IsolationLevel.SERIALIZABLE;
import static io.isolation.lab.harness.ScenarioAssertion.expect;
import static io.isolation.lab.harness.ScenarioAssertion.expectPrice;
import static io.isolation.lab.harness.ScenarioStep.begin;
import static io.isolation.lab.harness.ScenarioStep.commit;
import static io.isolation.lab.harness.ScenarioStep.count;
import static io.isolation.lab.harness.ScenarioStep.insert;
import static io.isolation.lab.harness.ScenarioStep.read;
import static io.isolation.lab.harness.ScenarioStep.rollback;
import static io.isolation.lab.harness.ScenarioStep.sleep;
import static io.isolation.lab.harness.ScenarioStep.update;

/**
 * The five canonical demonstrations. Actor {@code A} is the transaction under observation,
 * {@code B} the concurrent writer.
 */
public final class AnomalyScenarioCatalog {

    public static final String DIRTY_READ = "dirty-read";
    public static final String NON_REPEATABLE_READ = "non-repeatable-read";
    public static final String REPEATABLE_READ_NO_ANOMALY = "repeatable-read-no-anomaly";
    public static final String PHANTOM_READ = "phantom-read";
    public static final String SERIALIZABLE_NO_PHANTOM = "serializable-no-phantom";

    /** Rows matched by {@link #PREMIUM}: three of the five seeded. */
    static final ItemPredicate PREMIUM = ItemPredicate.priceAtLeast("50");

    private static final List<Item> CATALOG_ROWS = List.of(
        Item.of(1, "Apple", "150.00"),
        Item.of(2, "Pear", "75.00"),
        Item.of(3, "Plum", "50.00"),
        Item.of(4, "Grape", "10.00"),
        Item.of(5, "Melon", "90.00").markDeleted()
    );

    private static final List<AnomalyScenario> SCENARIOS = List.of(
        new AnomalyScenario(
            DIRTY_READ,
            "A changes the price without committing and holds its transaction open while B reads",
            List.of(Item.of(1, "Apple", "150.00")),
            List.of(new ActorSpec("A", READ_COMMITTED), new ActorSpec("B", READ_COMMITTED)),
            List.of(
                begin("A"),
                read("A", 1),
                update("A", 1, "50"),
                sleep("A"),
                begin("B"),
                read("B", 1),
                commit("B"),
                rollback("A")
            ),
            ScenarioAssertion.of("B reads the last committed price 150.00, never A's uncommitted 200.00",
                AnomalyScenarioCatalog::noDirtyRead)
        ),
        new AnomalyScenario(
            NON_REPEATABLE_READ,
            "A reads the same row twice at READ_COMMITTED while B commits an increment in between",
            List.of(Item.of(1, "demo", "150.00")),
            List.of(new ActorSpec("A", READ_COMMITTED), new ActorSpec("B", READ_COMMITTED)),
            List.of(
                begin("A"),
                read("A", 1),
                sleep("A"),
                begin("B"),
                update("B", 1, "1"),
                commit("B"),
                read("A", 1),
                commit("A")
            ),
            ScenarioAssertion.of("A's two reads differ by B's committed delta of 1",
                AnomalyScenarioCatalog::nonRepeatableRead)
        ),
        new AnomalyScenario(
            REPEATABLE_READ_NO_ANOMALY,
            "A reads the same row twice at REPEATABLE_READ while B commits an increment in between",
            List.of(Item.of(100, "rr-demo", "50.00")),
            List.of(new ActorSpec("A", REPEATABLE_READ), new ActorSpec("B", READ_COMMITTED)),
            List.of(
                begin("A"),
                read("A", 100),
                sleep("A"),
                begin("B"),
                update("B", 100, "1"),
                commit("B"),
                read("A", 100),
                commit("A")
            ),
            ScenarioAssertion.of("A's two reads are equal and A commits",
                AnomalyScenarioCatalog::repeatableRead)
        ),
        new AnomalyScenario(
            PHANTOM_READ,
            "A counts matching rows twice at READ_COMMITTED while B commits a new matching row",
            CATALOG_ROWS,
            List.of(new ActorSpec("A", READ_COMMITTED), new ActorSpec("B", READ_COMMITTED)),
            List.of(
                begin("A"),
                count("A", PREMIUM),
                sleep("A"),
                begin("B"),
                insert("B", Item.of(1001, "phantom-1", "100.00")),
                commit("B"),
                count("A", PREMIUM),
                commit("A")
            ),
            ScenarioAssertion.of("A's second count exceeds the first by the one inserted row",
                AnomalyScenarioCatalog::phantomRead)
        ),
        new AnomalyScenario(
            SERIALIZABLE_NO_PHANTOM,
            "A counts matching rows twice at SERIALIZABLE while B commits a new matching row",
            CATALOG_ROWS,
            List.of(new ActorSpec("A", SERIALIZABLE), new ActorSpec("B", READ_COMMITTED)),
            List.of(
                begin("A"),
                count("A", PREMIUM),
                sleep("A"),
                begin("B"),
                insert("B", Item.of(1002, "serial-1", "100.00")),
                commit("B"),
                count("A", PREMIUM),
                commit("A")
            ),
            ScenarioAssertion.of("never a phantom together with a successful commit by A",
                AnomalyScenarioCatalog::noPhantomUnderSerializable)
        )
    );

    private AnomalyScenarioCatalog() {
    }

    public static List<AnomalyScenario> scenarios() {
        return SCENARIOS;
    }

    public static List<String> names() {
        return SCENARIOS.stream().map(AnomalyScenario::name).toList();
    }

    public static Optional<AnomalyScenario> find(String name) {
        return SCENARIOS.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    private static void noDirtyRead(ScenarioResult result) {
        expectPrice(result.read("B", 0), "150.00", "B's read");
        expectPrice(finalPrice(result, 1), "150.00", "final price after A's rollback");
    }

    private static void nonRepeatableRead(ScenarioResult result) {
        var first = result.read("A", 0);
        var second = result.read("A", 1);
        expect(first.compareTo(second) != 0, "A read " + first.toPlainString() + " twice, no anomaly observed");
        expectPrice(second.subtract(first), "1", "difference between A's reads");
        expectPrice(finalPrice(result, 1), "151.00", "final price");
    }

    private static void repeatableRead(ScenarioResult result) {
        var first = result.read("A", 0);
        var second = result.read("A", 1);
        expect(first.compareTo(second) == 0,
            "A read " + first.toPlainString() + " then " + second.toPlainString() + " under REPEATABLE_READ");
        expect(result.committed("A"), "A did not commit");
        expectPrice(finalPrice(result, 100), "51.00", "final price");
    }

    private static void phantomRead(ScenarioResult result) {
        var first = result.count("A", 0);
        var second = result.count("A", 1);
        expect(first == 3, "A's first count expected 3 but was " + first);
        expect(second == first + 1, "A counted " + first + " then " + second + ", expected one phantom row");
    }

    private static void noPhantomUnderSerializable(ScenarioResult result) {
        if (result.failedWith("A", ErrorKind.SERIALIZATION_FAILURE)) {
            return;
        }
        var first = result.count("A", 0);
        var second = result.count("A", 1);
        expect(result.committed("A"), "A neither committed nor failed with a serialization failure");
        expect(first == second, "A counted " + first + " then " + second + " and still committed");
    }

    private static BigDecimal finalPrice(ScenarioResult result, long itemId) {
        return result.finalPrice(itemId)
            .orElseThrow(() -> new AssertionMismatchException(
                "item " + itemId + " missing from the table after the run"));
    }
}
