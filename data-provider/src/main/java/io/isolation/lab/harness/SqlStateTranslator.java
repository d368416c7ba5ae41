package io.isolation.lab.harness;

import java.sql.SQLException;
import java.util.Set;

/**
 * Maps PostgreSQL SQLSTATE codes onto the harness failure taxonomy.
 */
final class SqlStateTranslator {

    /** serialization_failure, deadlock_detected */
    private static final Set<String> SERIALIZATION = Set.of("40001", "40P01");

    /** lock_not_available (lock_timeout), query_canceled (statement_timeout) */
    private static final Set<String> TIMEOUT = Set.of("55P03", "57014");

    private SqlStateTranslator() {
    }

    static HarnessException translate(String operation, SQLException e) {
        var sqlState = e.getSQLState();
        var message = operation + " failed [" + sqlState + "]: " + e.getMessage();
        if (sqlState != null && SERIALIZATION.contains(sqlState)) {
            return new SerializationFailureException(message, e);
        }
        if (sqlState != null && TIMEOUT.contains(sqlState)) {
            return new LockTimeoutException(message, e);
        }
        return new StepExecutionException(message, e);
    }
}
