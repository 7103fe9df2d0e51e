package br.edu.ifba.cadgraph.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import br.edu.ifba.cadgraph.storage.GraphStoreException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TransientStoreFailurePredicate}.
 *
 * Transient classes: SQLSTATE 08/40/53/57, JDBC transient types, SQLite BUSY/LOCKED,
 * Neo4j transient and availability errors, timeouts. Everything else is permanent.
 */
class TransientStoreFailurePredicateTest {

    private TransientStoreFailurePredicate predicate;

    @BeforeEach
    void setUp() {
        predicate = new TransientStoreFailurePredicate();
    }

    @Nested
    @DisplayName("SQLSTATE classification")
    class SqlStates {

        @ParameterizedTest(name = "SQLSTATE {0} is transient")
        @ValueSource(strings = {"08000", "08006", "40001", "40P01", "53300", "57014", "57P01"})
        void testTransientStates(final String sqlState) {
            assertTrue(predicate.test(new SQLException("state " + sqlState, sqlState)));
        }

        @ParameterizedTest(name = "SQLSTATE {0} is permanent")
        @ValueSource(strings = {"23505", "23503", "42601", "42P01", "99999", ""})
        void testPermanentStates(final String sqlState) {
            assertFalse(predicate.test(new SQLException("state " + sqlState, sqlState)));
        }

        @Test
        @DisplayName("should return true when a chained next exception is transient")
        void testNextExceptionChain() {
            final SQLException batch = new SQLException("Batch entry failed", "22000");
            batch.setNextException(new SQLException("Deadlock", "40P01"));
            assertTrue(predicate.test(batch));
        }
    }

    @Nested
    @DisplayName("Java SQL transient exception types")
    class JavaTransientExceptions {

        @Test
        @DisplayName("should return true for SQLTransientConnectionException")
        void testSqlTransientConnectionException() {
            assertTrue(predicate.test(new SQLTransientConnectionException("Transient connection issue")));
        }

        @Test
        @DisplayName("should return true for SQLTimeoutException")
        void testSqlTimeoutException() {
            assertTrue(predicate.test(new SQLTimeoutException("Query timed out")));
        }
    }

    @Nested
    @DisplayName("SQLite result codes")
    class SQLiteCodes {

        @Test
        @DisplayName("should return true for SQLITE_BUSY")
        void testBusy() {
            assertTrue(predicate.test(new SQLiteException("[SQLITE_BUSY]", SQLiteErrorCode.SQLITE_BUSY)));
        }

        @Test
        @DisplayName("should return true for extended SQLITE_BUSY_SNAPSHOT")
        void testBusySnapshot() {
            assertTrue(predicate.test(new SQLiteException("[SQLITE_BUSY_SNAPSHOT]", SQLiteErrorCode.SQLITE_BUSY_SNAPSHOT)));
        }

        @Test
        @DisplayName("should return true for SQLITE_LOCKED")
        void testLocked() {
            assertTrue(predicate.test(new SQLiteException("[SQLITE_LOCKED]", SQLiteErrorCode.SQLITE_LOCKED)));
        }

        @Test
        @DisplayName("should return false for SQLITE_CONSTRAINT")
        void testConstraint() {
            assertFalse(predicate.test(new SQLiteException("[SQLITE_CONSTRAINT]", SQLiteErrorCode.SQLITE_CONSTRAINT)));
        }
    }

    @Nested
    @DisplayName("Neo4j driver exceptions")
    class Neo4jExceptions {

        @Test
        @DisplayName("should return true for TransientException")
        void testTransient() {
            assertTrue(predicate.test(new TransientException("Neo.TransientError.Transaction.DeadlockDetected", "deadlock")));
        }

        @Test
        @DisplayName("should return true for ServiceUnavailableException")
        void testServiceUnavailable() {
            assertTrue(predicate.test(new ServiceUnavailableException("no route")));
        }

        @Test
        @DisplayName("should return true for SessionExpiredException")
        void testSessionExpired() {
            assertTrue(predicate.test(new SessionExpiredException("leader switched")));
        }

        @Test
        @DisplayName("should return false for ClientException")
        void testClientError() {
            assertFalse(predicate.test(new ClientException("Neo.ClientError.Statement.SyntaxError", "Invalid input")));
        }
    }

    @Nested
    @DisplayName("Cause chain traversal")
    class CauseChainTraversal {

        @Test
        @DisplayName("should see through store and completion wrappers")
        void testWrappedTransient() {
            final GraphStoreException wrapped = new GraphStoreException("upsertBatch", "doc",
                "batch 3", new SQLException("Connection failed", "08000"));
            assertTrue(predicate.test(new CompletionException(wrapped)));
        }

        @Test
        @DisplayName("should return true for TimeoutException")
        void testTimeout() {
            assertTrue(predicate.test(new TimeoutException()));
        }

        @Test
        @DisplayName("should return false when only permanent failures are in the chain")
        void testPermanentOnly() {
            assertFalse(predicate.test(new RuntimeException("Wrapped", new SQLException("Constraint", "23505"))));
        }
    }

    @Nested
    @DisplayName("Edge Cases")
    class EdgeCases {

        @Test
        @DisplayName("should return false for null input")
        void testNullInput() {
            assertFalse(predicate.test(null));
        }

        @Test
        @DisplayName("should return true for lock message without SQL state")
        void testLockMessage() {
            assertTrue(predicate.test(new RuntimeException("database is locked")));
        }

        @Test
        @DisplayName("should return false for unrelated message")
        void testUnrelatedMessage() {
            assertFalse(predicate.test(new RuntimeException("Not a store error")));
        }
    }
}
