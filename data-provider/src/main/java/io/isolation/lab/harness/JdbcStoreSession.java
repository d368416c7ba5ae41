package io.isolation.lab.harness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link StoreSession} over one dedicated JDBC connection with autocommit off.
 * Timeouts are set with {@code SET LOCAL} so they end with the transaction and never leak
 * into the pool.
 */
class JdbcStoreSession implements StoreSession {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoreSession.class);

    static final String READ_PRICE = "SELECT price FROM items WHERE id = ?";
    static final String COUNT_MATCHING = "SELECT COUNT(*) FROM items WHERE price >= ? AND deleted = FALSE";
    static final String ADD_TO_PRICE = "UPDATE items SET price = price + ? WHERE id = ?";
    static final String INSERT_ITEM = "INSERT INTO items (id, name, price, deleted) VALUES (?, ?, ?, ?)";

    private final Connection connection;
    private final StatementBudget budget;

    JdbcStoreSession(Connection connection, StatementBudget budget) {
        this.connection = Objects.requireNonNull(connection, "connection cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
    }

    static int jdbcLevel(IsolationLevel level) {
        return switch (level) {
            case READ_UNCOMMITTED -> Connection.TRANSACTION_READ_UNCOMMITTED;
            case READ_COMMITTED -> Connection.TRANSACTION_READ_COMMITTED;
            case REPEATABLE_READ -> Connection.TRANSACTION_REPEATABLE_READ;
            case SERIALIZABLE -> Connection.TRANSACTION_SERIALIZABLE;
        };
    }

    @Override
    public void begin(IsolationLevel isolationLevel) {
        try {
            connection.setTransactionIsolation(jdbcLevel(isolationLevel));
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute("SET LOCAL statement_timeout = " + budget.statementTimeout().toMillis());
                statement.execute("SET LOCAL lock_timeout = " + budget.lockTimeout().toMillis());
            }
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("BEGIN " + isolationLevel, e);
        }
    }

    @Override
    public Optional<BigDecimal> readPrice(long itemId) {
        try (var statement = connection.prepareStatement(READ_PRICE)) {
            statement.setLong(1, itemId);
            try (var rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(rs.getBigDecimal(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("READ item " + itemId, e);
        }
    }

    @Override
    public long count(ItemPredicate predicate) {
        try (var statement = connection.prepareStatement(COUNT_MATCHING)) {
            statement.setBigDecimal(1, predicate.minPrice());
            try (var rs = statement.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("COUNT " + predicate, e);
        }
    }

    @Override
    public int addToPrice(long itemId, BigDecimal delta) {
        try (var statement = connection.prepareStatement(ADD_TO_PRICE)) {
            statement.setBigDecimal(1, delta);
            statement.setLong(2, itemId);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("UPDATE item " + itemId, e);
        }
    }

    @Override
    public void insert(Item item) {
        try (var statement = connection.prepareStatement(INSERT_ITEM)) {
            statement.setLong(1, item.id());
            statement.setString(2, item.name());
            statement.setBigDecimal(3, item.price());
            statement.setBoolean(4, item.deleted());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("INSERT item " + item.id(), e);
        }
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("COMMIT", e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("ROLLBACK", e);
        }
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed() && !connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback before release failed: {}", e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                throw SqlStateTranslator.translate("CLOSE", e);
            }
        }
    }
}
