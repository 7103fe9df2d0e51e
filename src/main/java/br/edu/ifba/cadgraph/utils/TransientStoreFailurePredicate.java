package br.edu.ifba.cadgraph.utils;

import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate to determine if a graph store failure is transient and worth retrying.
 *
 * <p>Walks the cause chain, so wrapped failures ({@code GraphStoreException},
 * {@code CompletionException}) are classified by their root.</p>
 *
 * <h2>Transient (Will Retry):</h2>
 * <ul>
 *   <li>{@link TimeoutException}: a store attempt exceeded its wait bound</li>
 *   <li>{@link SQLTransientException} and {@link SQLTimeoutException}</li>
 *   <li>SQLite {@code SQLITE_BUSY} / {@code SQLITE_LOCKED}, including extended codes</li>
 *   <li>SQLSTATE classes 08 (connection), 40 (rollback/deadlock), 53 (resources), 57 (operator intervention)</li>
 *   <li>Neo4j {@link TransientException} (deadlocks, lock timeouts), {@link ServiceUnavailableException},
 *       {@link SessionExpiredException}</li>
 *   <li>Messages matching known connection/lock patterns</li>
 * </ul>
 *
 * <h2>Permanent (Will NOT Retry):</h2>
 * <ul>
 *   <li>Constraint violations, syntax errors, serialization errors</li>
 *   <li>Everything else</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * StoreCallGuard guard = new StoreCallGuard(3, Duration.ofMillis(200), Duration.ofSeconds(5),
 *     Duration.ofSeconds(30), new TransientStoreFailurePredicate(), events);
 * CommitStats stats = guard.execute("upsertBatch#3", () -> store.upsertBatch(documentId, batch));
 * }</pre>
 */
public final class TransientStoreFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientStoreFailurePredicate.class);

    private static final int MAX_CAUSE_DEPTH = 16;

    /**
     * SQLSTATE prefixes that indicate transient (retryable) errors.
     */
    private static final Set<String> TRANSIENT_SQLSTATE_PREFIXES = Set.of(
        "08", // Connection Exception
        "40", // Transaction Rollback (deadlock)
        "53", // Insufficient Resources
        "57"  // Operator Intervention
    );

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|broken)" +
        "|unable\\s+to\\s+(connect|acquire\\s+connection)" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset|error)" +
        "|read\\s+timed\\s*out" +
        "|database\\s+(is\\s+locked|unavailable|shutdown|restarting)" +
        "|database\\s+table\\s+is\\s+locked" +
        "|deadlock\\s+detected" +
        "|lock\\s+wait\\s+timeout" +
        "|could\\s+not\\s+serialize\\s+access" +
        "|temporarily\\s+unavailable" +
        "|try\\s+(again|later)" +
        ")"
    );

    /**
     * Tests whether the failure, or any failure in its cause chain, is transient.
     *
     * @param throwable the failure to test (may be null)
     * @return {@code true} if the operation should be retried
     */
    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (isTransient(current)) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause == current ? null : cause;
        }
        return false;
    }

    private boolean isTransient(final Throwable throwable) {
        if (throwable instanceof TimeoutException) {
            logger.debug("Store attempt timed out");
            return true;
        }

        if (throwable instanceof TransientException
                || throwable instanceof ServiceUnavailableException
                || throwable instanceof SessionExpiredException) {
            logger.debug("Transient Neo4j failure detected: {}", throwable.getClass().getSimpleName());
            return true;
        }

        if (throwable instanceof SQLTransientException || throwable instanceof SQLTimeoutException) {
            logger.debug("Transient SQL exception detected: {}", throwable.getMessage());
            return true;
        }

        if (throwable instanceof SQLiteException sqliteException && isBusyOrLocked(sqliteException)) {
            logger.debug("SQLite busy/locked detected: {}", sqliteException.getResultCode());
            return true;
        }

        if (throwable instanceof SQLException sqlException) {
            SQLException next = sqlException;
            while (next != null) {
                if (isTransientSqlState(next)) {
                    return true;
                }
                next = next.getNextException();
            }
        }

        return isTransientByMessage(throwable.getMessage());
    }

    private boolean isBusyOrLocked(final SQLiteException exception) {
        SQLiteErrorCode code = exception.getResultCode();
        if (code == null) {
            return false;
        }
        // extended result codes carry the primary code in the low byte
        int primary = code.code & 0xFF;
        return primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code;
    }

    private boolean isTransientSqlState(final SQLException sqlException) {
        final String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return false;
        }

        final String prefix = sqlState.substring(0, 2);
        if (TRANSIENT_SQLSTATE_PREFIXES.contains(prefix)) {
            logger.debug("Transient SQLSTATE detected: {}, message: {}", sqlState, sqlException.getMessage());
            return true;
        }
        return false;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }

        if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient failure detected by message pattern: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }
        return false;
    }
}
