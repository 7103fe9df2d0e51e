package br.edu.ifba.cadgraph.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link RetryEventLogger}.
 *
 * <p>Retry events are logged with MDC context, which must never leak past the
 * logging call.</p>
 */
class RetryEventLoggerTest {

    private RetryEventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RetryEventLogger();
        MDC.clear();
    }

    private static void assertMdcCleared() {
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_OPERATION), "MDC should be cleared after logging");
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_ATTEMPT), "MDC should be cleared after logging");
        assertNull(MDC.get(RetryEventLogger.MDC_RETRY_EXCEPTION), "MDC should be cleared after logging");
    }

    @Nested
    @DisplayName("Retry attempt logging")
    class RetryAttemptLogging {

        @Test
        @DisplayName("logRetryAttempt clears MDC context afterwards")
        void testLogRetryAttemptClearsMdc() {
            logger.logRetryAttempt("upsertBatch#4", 2, 3, new SQLException("Connection reset", "08006"));
            assertMdcCleared();
        }

        @Test
        @DisplayName("logRetryAttempt handles null failure")
        void testNullFailure() {
            logger.logRetryAttempt("getNodesByLabel:Profile", 2, 3, null);
            assertMdcCleared();
        }

        @Test
        @DisplayName("long messages are truncated without error")
        void testLongMessage() {
            logger.logRetryAttempt("upsertBatch#5", 2, 3, new RuntimeException("x".repeat(500)));
            assertMdcCleared();
        }
    }

    @Nested
    @DisplayName("Exhaustion and success")
    class ExhaustionAndSuccess {

        @Test
        @DisplayName("logRetryExhausted clears MDC context afterwards")
        void testExhausted() {
            logger.logRetryExhausted("adjacency#0", 3, new SQLException("Too many connections", "53300"));
            assertMdcCleared();
        }

        @Test
        @DisplayName("logRetrySuccess is silent on first attempt and clears context otherwise")
        void testSuccess() {
            logger.logRetrySuccess("upsertBatch#1", 1);
            logger.logRetrySuccess("upsertBatch#1", 3);
            assertMdcCleared();
        }

        @Test
        @DisplayName("unrelated MDC entries survive")
        void testForeignMdcKept() {
            MDC.put("document", "doc-7");

            logger.logRetryExhausted("upsertBatch#9", 3, new RuntimeException("boom"));

            assertEquals("doc-7", MDC.get("document"));
            assertMdcCleared();
            MDC.clear();
        }
    }
}
