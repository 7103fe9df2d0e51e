package br.edu.ifba.cadgraph.pipeline;

import java.time.Duration;
import java.util.Objects;

import br.edu.ifba.cadgraph.transform.TransformSettings;
import br.edu.ifba.cadgraph.utils.RetryEventLogger;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;
import br.edu.ifba.cadgraph.utils.TransientStoreFailurePredicate;

/**
 * Settings of a pipeline run.
 *
 * @param maxRecordsPerBatch nodes plus relationships per extraction batch
 * @param maxAttempts store attempts per batch or read, first attempt included
 * @param initialBackoff delay before the first retry
 * @param maxBackoff upper bound of a single retry delay
 * @param attemptTimeout how long one store attempt runs before it counts as timed out
 * @param transform transformer switches
 */
public record PipelineSettings(int maxRecordsPerBatch, int maxAttempts, Duration initialBackoff,
        Duration maxBackoff, Duration attemptTimeout, TransformSettings transform) {

    public static final PipelineSettings DEFAULT = new PipelineSettings(1000, 3, Duration.ofMillis(200),
        Duration.ofSeconds(5), Duration.ofSeconds(30), TransformSettings.DEFAULT);

    public PipelineSettings {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");
        if (maxRecordsPerBatch < 1) {
            throw new IllegalArgumentException("maxRecordsPerBatch must be at least 1, got " + maxRecordsPerBatch);
        }
    }

    /**
     * Builds the settings from the mapped configuration.
     */
    public static PipelineSettings from(CadGraphConfig config) {
        config.validate();
        CadGraphConfig.Loader loader = config.loader();
        return new PipelineSettings(
            config.batch().maxRecords(),
            loader.maxAttempts(),
            Duration.ofMillis(loader.initialBackoffMs()),
            Duration.ofMillis(loader.maxBackoffMs()),
            Duration.ofMillis(loader.attemptTimeoutMs()),
            new TransformSettings(
                config.transform().enabled(),
                config.transform().batchSize(),
                config.transform().parallel()));
    }

    /**
     * Guard for loader and transformer store calls, retrying the failures
     * {@link TransientStoreFailurePredicate} considers transient.
     */
    public StoreCallGuard storeCallGuard(RetryEventLogger events) {
        return new StoreCallGuard(maxAttempts, initialBackoff, maxBackoff, attemptTimeout,
            new TransientStoreFailurePredicate(), events);
    }
}
