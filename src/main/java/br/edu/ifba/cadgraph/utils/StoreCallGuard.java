package br.edu.ifba.cadgraph.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.smallrye.faulttolerance.api.FaultTolerance;

/**
 * Runs asynchronous store calls under a SmallRye Fault Tolerance retry.
 *
 * <p>Transient failures, as judged by the failure predicate, are retried with
 * exponential backoff until {@code maxAttempts} attempts were made; anything
 * else fails at once. Attempts run one at a time on the calling thread: an
 * attempt that outlives {@code attemptTimeout} is waited for until the store
 * settles it, so a retry never overlaps an earlier write. A late success is
 * the attempt's result; a late failure is retried like any other. Stores bound
 * their own calls with transaction and query timeouts.</p>
 */
public final class StoreCallGuard {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallGuard.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration attemptTimeout;
    private final Predicate<Throwable> transientFailure;
    private final RetryEventLogger events;

    /**
     * @param maxAttempts attempts per call, first attempt included
     * @param initialBackoff delay before the first retry, doubled for every further retry
     * @param maxBackoff upper bound of a single delay
     * @param attemptTimeout how long an attempt runs before it counts as timed out
     * @param transientFailure decides which failures are retried
     * @param events retry logging
     */
    public StoreCallGuard(int maxAttempts, @NotNull Duration initialBackoff, @NotNull Duration maxBackoff,
            @NotNull Duration attemptTimeout, @NotNull Predicate<Throwable> transientFailure,
            @NotNull RetryEventLogger events) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                "Backoff must satisfy 0 <= initial <= max, got " + initialBackoff + " / " + maxBackoff);
        }
        if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be positive, got " + attemptTimeout);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.attemptTimeout = attemptTimeout;
        this.transientFailure = transientFailure;
        this.events = events;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration attemptTimeout() {
        return attemptTimeout;
    }

    /**
     * Executes the call, retrying transient failures.
     *
     * @param operation name used in logs and in the exception
     * @param call starts one attempt; invoked once per attempt
     * @return the value of the first successful attempt
     * @throws RetryExhaustedException if no attempt succeeded
     */
    public <T> T execute(@NotNull String operation, @NotNull Supplier<CompletableFuture<T>> call)
            throws RetryExhaustedException {
        Attempts attempts = new Attempts();
        Callable<T> guarded = FaultTolerance.createCallable(() -> attempt(operation, call, attempts))
            .withDescription(operation)
            .withRetry()
                .maxRetries(maxAttempts - 1)
                .delay(initialBackoff.toMillis(), ChronoUnit.MILLIS)
                .jitter(0, ChronoUnit.MILLIS)
                .maxDuration(retryBudget().toMillis(), ChronoUnit.MILLIS)
                .whenException(transientFailure)
                .withExponentialBackoff()
                    .factor(2)
                    .maxDelay(maxBackoff.toMillis(), ChronoUnit.MILLIS)
                    .done()
                .done()
            .build();

        try {
            T result = guarded.call();
            events.logRetrySuccess(operation, attempts.count);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryExhaustedException(operation, Math.max(attempts.count, 1), false, e);
        } catch (Exception e) {
            Throwable failure = attempts.lastFailure != null ? attempts.lastFailure : unwrap(e);
            boolean retryable = transientFailure.test(failure);
            if (retryable) {
                events.logRetryExhausted(operation, attempts.count, failure);
            }
            throw new RetryExhaustedException(operation, Math.max(attempts.count, 1), retryable, failure);
        }
    }

    private <T> T attempt(String operation, Supplier<CompletableFuture<T>> call, Attempts attempts) throws Exception {
        attempts.count++;
        if (attempts.count > 1) {
            events.logRetryAttempt(operation, attempts.count, maxAttempts, attempts.lastFailure);
        }
        try {
            return await(operation, call.get());
        } catch (Exception e) {
            Throwable failure = unwrap(e);
            attempts.lastFailure = failure;
            throw asException(failure);
        }
    }

    private <T> T await(String operation, CompletableFuture<T> future) throws Exception {
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeout) {
            logger.warn("{} still running after {} ms, waiting for the store to settle it",
                operation, attemptTimeout.toMillis());
            try {
                T late = future.join();
                logger.info("{} completed after its attempt timeout", operation);
                return late;
            } catch (CompletionException | CancellationException e) {
                Throwable failure = unwrap(e);
                failure.addSuppressed(timeout);
                throw asException(failure);
            }
        }
    }

    // Upper bound for the whole retry; attempts may outlive their timeout while they settle.
    private Duration retryBudget() {
        return attemptTimeout.plus(maxBackoff).multipliedBy(2L * maxAttempts);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof CancellationException) {
            return new TimeoutException("Store attempt was cancelled");
        }
        return current;
    }

    private static Exception asException(Throwable failure) {
        if (failure instanceof Exception exception) {
            return exception;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new CompletionException(failure);
    }

    private static final class Attempts {
        private int count;
        private Throwable lastFailure;
    }
}
