package br.edu.ifba.cadgraph.pipeline;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Pipeline configuration.
 *
 * All properties are read from application.properties with the prefix
 * "cadgraph". Storage connection settings are read by the storage providers.
 */
@ConfigMapping(prefix = "cadgraph")
public interface CadGraphConfig {

    /**
     * Extraction batch configuration group.
     */
    Batch batch();

    /**
     * Loader retry configuration group.
     */
    Loader loader();

    /**
     * Transformer configuration group.
     */
    Transform transform();

    /**
     * Validates cross-property constraints at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (loader().maxBackoffMs() < loader().initialBackoffMs()) {
            throw new IllegalArgumentException(String.format(
                "cadgraph.loader.max-backoff-ms (%d) must not be below cadgraph.loader.initial-backoff-ms (%d)",
                loader().maxBackoffMs(), loader().initialBackoffMs()));
        }
        if (batch().maxRecords() < 1) {
            throw new IllegalArgumentException(
                String.format("cadgraph.batch.max-records must be positive, got %d", batch().maxRecords()));
        }
    }

    interface Batch {
        /**
         * Nodes plus relationships per extraction batch.
         * Default: 1000
         */
        @WithDefault("1000")
        @Min(1)
        int maxRecords();
    }

    interface Loader {
        /**
         * Commit attempts per batch, first attempt included.
         * Default: 3
         */
        @WithDefault("3")
        @Min(1)
        @Max(10)
        int maxAttempts();

        /**
         * Delay before the first retry; doubled on every further retry.
         * Default: 200
         */
        @WithDefault("200")
        @Min(0)
        long initialBackoffMs();

        /**
         * Upper bound of a single retry delay.
         * Default: 5000
         */
        @WithDefault("5000")
        @Min(0)
        long maxBackoffMs();

        /**
         * How long one attempt may wait for the store.
         * Default: 30000
         */
        @WithDefault("30000")
        @Min(1)
        long attemptTimeoutMs();
    }

    interface Transform {
        @WithDefault("true")
        boolean enabled();

        /**
         * Derived relationships per transaction.
         * Default: 500
         */
        @WithDefault("500")
        @Min(1)
        int batchSize();

        @WithDefault("true")
        boolean parallel();
    }
}
