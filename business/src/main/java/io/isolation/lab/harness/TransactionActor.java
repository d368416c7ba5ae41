package io.isolation.lab.harness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named participant holding exactly one store session and at most one transaction.
 *
 * <p>State moves NOT_STARTED → ACTIVE → COMMITTED | ROLLED_BACK | FAILED and never back.
 * Any store failure rolls the transaction back and leaves the actor FAILED before the
 * exception reaches the caller.
 */
public final class TransactionActor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionActor.class);

    private final String role;
    private final IsolationLevel isolationLevel;
    private final StoreSession session;
    private final Sleeper sleeper;

    private ActorState state = ActorState.NOT_STARTED;
    private boolean closed;

    public TransactionActor(String role, IsolationLevel isolationLevel,
                            StoreSession session, Sleeper sleeper) {
        this.role = Objects.requireNonNull(role, "role cannot be null");
        this.isolationLevel = Objects.requireNonNull(isolationLevel, "isolationLevel cannot be null");
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    public void begin() {
        begin(isolationLevel);
    }

    public void begin(IsolationLevel level) {
        if (state != ActorState.NOT_STARTED) {
            throw new ActorMisuseException(role + " cannot begin: transaction already " + state);
        }
        guarded(() -> {
            session.begin(level);
            return null;
        });
        state = ActorState.ACTIVE;
    }

    public BigDecimal read(long itemId) {
        requireActive("read");
        return guarded(() -> session.readPrice(itemId))
            .orElseThrow(() -> new AssertionMismatchException("item " + itemId + " is not visible to " + role));
    }

    public long count(ItemPredicate predicate) {
        requireActive("count");
        return guarded(() -> session.count(predicate));
    }

    public void update(long itemId, BigDecimal delta) {
        requireActive("update");
        int changed = guarded(() -> session.addToPrice(itemId, delta));
        if (changed == 0) {
            throw new AssertionMismatchException("item " + itemId + " not found for update by " + role);
        }
    }

    public void insert(Item row) {
        requireActive("insert");
        guarded(() -> {
            session.insert(row);
            return null;
        });
    }

    /** Leaves the transaction open and untouched; only a positive duration actually waits. */
    public void sleep(Duration duration) {
        requireActive("sleep");
        if (!duration.isZero()) {
            sleeper.sleep(duration);
        }
    }

    public void commit() {
        requireActive("commit");
        guarded(() -> {
            session.commit();
            return null;
        });
        state = ActorState.COMMITTED;
    }

    public void rollback() {
        requireActive("rollback");
        try {
            session.rollback();
        } catch (HarnessException e) {
            log.warn("{}: rollback reported {}, transaction is discarded anyway", role, e.getMessage());
        }
        state = ActorState.ROLLED_BACK;
    }

    /** Rolls back a still-active transaction and releases the session. Safe to call twice. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (state == ActorState.ACTIVE) {
                rollback();
            }
        } finally {
            session.close();
        }
    }

    public String role() {
        return role;
    }

    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    public ActorState state() {
        return state;
    }

    private void requireActive(String operation) {
        if (closed || state != ActorState.ACTIVE) {
            throw new ActorMisuseException(role + " cannot " + operation + " while " + (closed ? "closed" : state));
        }
    }

    private <T> T guarded(Supplier<T> storeCall) {
        try {
            return storeCall.get();
        } catch (SerializationFailureException | LockTimeoutException | StepExecutionException e) {
            fail(e);
            throw e;
        } catch (HarnessException e) {
            throw e;
        } catch (RuntimeException e) {
            var wrapped = new StepExecutionException(role + ": " + e.getMessage(), e);
            fail(wrapped);
            throw wrapped;
        }
    }

    private void fail(HarnessException cause) {
        try {
            session.rollback();
        } catch (HarnessException e) {
            cause.addSuppressed(e);
        }
        state = ActorState.FAILED;
        log.debug("{}: transaction failed with {}", role, cause.kind());
    }
}
