package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One live connection to the store. Implementations translate store errors into
 * {@link SerializationFailureException}, {@link LockTimeoutException} or
 * {@link StepExecutionException}.
 */
public interface StoreSession extends AutoCloseable {

    void begin(IsolationLevel isolationLevel);

    Optional<BigDecimal> readPrice(long itemId);

    long count(ItemPredicate predicate);

    /** @return number of rows changed */
    int addToPrice(long itemId, BigDecimal delta);

    void insert(Item item);

    void commit();

    void rollback();

    @Override
    void close();
}
