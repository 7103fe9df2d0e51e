package br.edu.ifba.cadgraph.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging of store retry events.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>retry.operation</code> - The operation being retried, e.g. {@code upsertBatch#12}</li>
 *   <li><code>retry.attempt</code> - Attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - Exception class name that triggered the retry</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/3 for upsertBatch#12: SQLiteException - [SQLITE_BUSY] database is locked
 * WARN  [RetryEventLogger] Retry exhausted for upsertBatch#12 after 3 attempts: TimeoutException - null
 * INFO  [RetryEventLogger] Retry succeeded for upsertBatch#12 on attempt 2
 * </pre>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_RETRY_OPERATION = "retry.operation";
    static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs that an attempt is about to be retried.
     *
     * @param operation the name of the operation being retried
     * @param attempt the number of the upcoming attempt (1-based)
     * @param maxAttempts the attempt budget
     * @param failure the failure that triggered the retry (may be null)
     */
    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            putContext(operation, attempt, exceptionName);
            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName, truncateMessage(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs that the attempt budget has been spent.
     *
     * @param operation the name of the operation that failed
     * @param totalAttempts the total number of attempts made
     * @param failure the final failure
     */
    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        try {
            putContext(operation, totalAttempts, exceptionName);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, truncateMessage(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a success; silent when the first attempt succeeded.
     *
     * @param operation the name of the operation that succeeded
     * @param totalAttempts the total number of attempts made
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            putContext(operation, totalAttempts, null);
            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void putContext(final String operation, final int attempt, final String exceptionName) {
        MDC.put(MDC_RETRY_OPERATION, operation);
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        if (exceptionName != null) {
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private String truncateMessage(final Throwable failure) {
        final String message = failure != null ? failure.getMessage() : null;
        if (message == null) {
            return "no message";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
