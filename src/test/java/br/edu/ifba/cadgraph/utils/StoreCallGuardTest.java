package br.edu.ifba.cadgraph.utils;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link StoreCallGuard}.
 */
class StoreCallGuardTest {

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private StoreCallGuard guard;

    @BeforeEach
    void setUp() {
        calls.set(0);
        inFlight.set(0);
        maxInFlight.set(0);
        guard = guardWith(3, Duration.ofSeconds(5));
    }

    private static StoreCallGuard guardWith(final int maxAttempts, final Duration attemptTimeout) {
        return new StoreCallGuard(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(4), attemptTimeout,
            new TransientStoreFailurePredicate(), new RetryEventLogger());
    }

    private CompletableFuture<String> failThenSucceed(final int failures, final Throwable failure) {
        if (calls.incrementAndGet() <= failures) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture("ok");
    }

    private CompletableFuture<String> slowCall(final long millis, final RuntimeException failure) {
        calls.incrementAndGet();
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        return CompletableFuture.supplyAsync(() -> {
            try {
                TimeUnit.MILLISECONDS.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return "late";
        });
    }

    @Test
    @DisplayName("rejects settings that cannot drive a retry")
    void testRejectsInvalidSettings() {
        final RetryEventLogger events = new RetryEventLogger();
        final TransientStoreFailurePredicate predicate = new TransientStoreFailurePredicate();

        assertThrows(IllegalArgumentException.class, () -> new StoreCallGuard(0, Duration.ofMillis(1),
            Duration.ofMillis(1), Duration.ofSeconds(1), predicate, events));
        assertThrows(IllegalArgumentException.class, () -> new StoreCallGuard(3, Duration.ofMillis(10),
            Duration.ofMillis(5), Duration.ofSeconds(1), predicate, events));
        assertThrows(IllegalArgumentException.class, () -> new StoreCallGuard(3, Duration.ofMillis(1),
            Duration.ofMillis(5), Duration.ZERO, predicate, events));
    }

    @Nested
    @DisplayName("Transient failures")
    class TransientFailures {

        @Test
        @DisplayName("succeeds after transient failures")
        void testRetriesThenSucceeds() throws Exception {
            final SQLException busy = new SQLException("database is locked");

            final String result = guard.execute("upsertBatch#1", () -> failThenSucceed(2, busy));

            assertEquals("ok", result);
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("gives up after maxAttempts and reports a transient failure")
        void testExhaustion() {
            final SQLException connection = new SQLException("Connection failed", "08006");

            final RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> guard.execute("upsertBatch#2", () -> failThenSucceed(10, connection)));

            assertEquals(3, calls.get());
            assertEquals(3, e.getAttempts());
            assertTrue(e.isTransientFailure());
            assertEquals(connection, e.getCause());
            assertEquals("upsertBatch#2", e.getOperation());
        }
    }

    @Nested
    @DisplayName("Attempt timeout")
    class AttemptTimeout {

        @Test
        @DisplayName("an attempt outliving its timeout is awaited and its late result kept")
        void testLateSuccessIsTheResult() throws Exception {
            final StoreCallGuard fast = guardWith(3, Duration.ofMillis(50));

            final String result = fast.execute("upsertBatch#1", () -> slowCall(300, null));

            assertEquals("late", result);
            assertEquals(1, calls.get(), "A late success must not be written again");
            assertEquals(1, maxInFlight.get());
        }

        @Test
        @DisplayName("a late failure is retried only after the attempt has settled")
        void testLateFailureDoesNotOverlapRetry() {
            final StoreCallGuard fast = guardWith(2, Duration.ofMillis(50));
            final RuntimeException reset = new RuntimeException("connection reset by peer");

            final RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> fast.execute("upsertBatch#2", () -> slowCall(150, reset)));

            assertEquals(2, calls.get());
            assertEquals(1, maxInFlight.get(), "Attempts must never run concurrently");
            assertTrue(e.isTransientFailure());
            assertEquals(reset, e.getCause());
            assertTrue(e.getCause().getSuppressed()[0] instanceof TimeoutException,
                "The timeout is kept as a suppressed exception");
        }
    }

    @Nested
    @DisplayName("Permanent failures")
    class PermanentFailures {

        @Test
        @DisplayName("permanent failure is not retried")
        void testPermanentNotRetried() {
            final SQLException constraint = new SQLException("Duplicate key", "23505");

            final RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> guard.execute("upsertBatch#3", () -> failThenSucceed(10, constraint)));

            assertEquals(1, calls.get());
            assertEquals(1, e.getAttempts());
            assertFalse(e.isTransientFailure());
        }

        @Test
        @DisplayName("exception thrown before a future is returned is classified too")
        void testSynchronousThrow() {
            final RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> guard.execute("getStats", () -> {
                    throw new IllegalStateException("Store not initialized. Call initialize() first.");
                }));

            assertFalse(e.isTransientFailure());
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }
}
