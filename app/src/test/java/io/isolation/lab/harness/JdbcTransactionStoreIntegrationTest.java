package io.isolation.lab.harness;

import io.isolation.lab.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTransactionStoreIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private TransactionStore transactionStore;

    @BeforeEach
    void setUp() {
        transactionStore.resetFixture(List.of(
            Item.of(1L, "Apple", "150.00"),
            Item.of(2L, "Pear", "75.00")
        ));
    }

    @Test
    @DisplayName("Should replace every row on fixture reset and return committed rows ordered by id")
    void shouldResetFixture() {
        transactionStore.resetFixture(List.of(Item.of(7L, "Fig", "9.99"), Item.of(3L, "Plum", "50.00")));

        assertThat(transactionStore.committedRows())
            .extracting(Item::id, Item::name)
            .containsExactly(
                tuple(3L, "Plum"),
                tuple(7L, "Fig"));
    }

    @Test
    @DisplayName("Should fail the second writer with a lock timeout while the first holds the row")
    void shouldTimeOutCompetingWriter() {
        try (var first = transactionStore.openSession(); var second = transactionStore.openSession()) {
            first.begin(IsolationLevel.READ_COMMITTED);
            second.begin(IsolationLevel.READ_COMMITTED);

            assertThat(first.addToPrice(1L, BigDecimal.ONE)).isEqualTo(1);
            assertThatThrownBy(() -> second.addToPrice(1L, BigDecimal.TEN))
                .isInstanceOf(LockTimeoutException.class);

            first.rollback();
            second.rollback();
        }

        assertThat(transactionStore.committedRows().get(0).price()).isEqualByComparingTo(new BigDecimal("150.00"));
    }

    @Test
    @DisplayName("Should reject a write to a row changed after the REPEATABLE READ snapshot")
    void shouldRaiseSerializationFailureOnStaleSnapshotWrite() {
        try (var reader = transactionStore.openSession(); var writer = transactionStore.openSession()) {
            reader.begin(IsolationLevel.REPEATABLE_READ);
            assertThat(reader.readPrice(2L)).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo(new BigDecimal("75.00")));

            writer.begin(IsolationLevel.READ_COMMITTED);
            writer.addToPrice(2L, BigDecimal.ONE);
            writer.commit();

            assertThatThrownBy(() -> reader.addToPrice(2L, BigDecimal.ONE))
                .isInstanceOf(SerializationFailureException.class);
            reader.rollback();
        }

        assertThat(transactionStore.committedRows().get(1).price()).isEqualByComparingTo(new BigDecimal("76.00"));
    }

    @Test
    @DisplayName("Should discard uncommitted work when a session is closed")
    void shouldRollbackOnClose() {
        try (var session = transactionStore.openSession()) {
            session.begin(IsolationLevel.SERIALIZABLE);
            session.insert(Item.of(1001L, "phantom-1", "100.00"));
        }

        assertThat(transactionStore.committedRows()).extracting(Item::id).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should report a duplicate insert as a step execution error")
    void shouldFailDuplicateInsert() {
        try (var session = transactionStore.openSession()) {
            session.begin(IsolationLevel.READ_COMMITTED);

            assertThatThrownBy(() -> session.insert(Item.of(1L, "Apple again", "1.00")))
                .isInstanceOf(StepExecutionException.class)
                .hasMessageContaining("23505");
            session.rollback();
        }
    }
}
