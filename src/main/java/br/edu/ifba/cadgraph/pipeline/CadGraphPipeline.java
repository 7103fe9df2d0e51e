package br.edu.ifba.cadgraph.pipeline;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.EntityIdentityService;
import br.edu.ifba.cadgraph.core.GraphRecordBuilder;
import br.edu.ifba.cadgraph.extract.DesignTraverser;
import br.edu.ifba.cadgraph.extract.ExtractionContext;
import br.edu.ifba.cadgraph.extract.ExtractorRegistry;
import br.edu.ifba.cadgraph.extract.TraversalResult;
import br.edu.ifba.cadgraph.host.CadDesign;
import br.edu.ifba.cadgraph.load.BatchLoader;
import br.edu.ifba.cadgraph.load.LoadReport;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.storage.GraphStoreUnavailableException;
import br.edu.ifba.cadgraph.transform.GraphTransformer;
import br.edu.ifba.cadgraph.transform.TransformReport;
import br.edu.ifba.cadgraph.utils.RetryEventLogger;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;

/**
 * Extracts a CAD design into the graph store: traversal, batched loading, then
 * derivation passes.
 *
 * <p>Only an unreachable store at start fails the run. Skipped entities, abandoned
 * batches and failed passes are reported in the {@link RunSummary}; losing the
 * host mid-traversal yields a {@link RunStatus#PARTIAL} run over what was
 * extracted so far.</p>
 */
public class CadGraphPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CadGraphPipeline.class);

    private final GraphStore store;
    private final PipelineSettings settings;
    private final ExtractorRegistry registry;
    private final StoreCallGuard storeGuard;

    public CadGraphPipeline(@NotNull GraphStore store, @NotNull PipelineSettings settings,
            @NotNull RetryEventLogger retryEvents) {
        this(store, settings, ExtractorRegistry.withDefaults(), settings.storeCallGuard(retryEvents));
    }

    public CadGraphPipeline(@NotNull GraphStore store, @NotNull PipelineSettings settings,
            @NotNull ExtractorRegistry registry, @NotNull StoreCallGuard storeGuard) {
        this.store = store;
        this.settings = settings;
        this.registry = registry;
        this.storeGuard = storeGuard;
    }

    /**
     * Runs the pipeline for one design.
     *
     * @param design the open design
     * @param documentId partition key of the document in the store
     * @return the run report
     * @throws GraphStoreUnavailableException if the store cannot be initialized
     */
    public RunSummary run(@NotNull CadDesign design, @NotNull String documentId) {
        long start = System.nanoTime();
        initializeStore();
        logger.info("Extracting design '{}' into document {}", design.name(), documentId);

        TraversalResult traversal;
        LoadReport load;
        try (BatchLoader loader = new BatchLoader(store, documentId, storeGuard)) {
            GraphRecordBuilder builder = new GraphRecordBuilder(settings.maxRecordsPerBatch(), loader::submit);
            ExtractionContext context = new ExtractionContext(new EntityIdentityService());
            traversal = new DesignTraverser(registry, context, builder).traverse(design);
            builder.flush();
            load = loader.awaitCompletion();
            if (context.unresolvedReferences() > 0) {
                logger.info("Document {}: {} references dropped for lack of a target identity",
                    documentId, context.unresolvedReferences());
            }
        }

        TransformReport transform = GraphTransformer
            .withDefaultPasses(store, storeGuard, settings.transform())
            .transform(documentId);

        RunStatus status;
        if (traversal.aborted()) {
            status = RunStatus.PARTIAL;
        } else if (load.hasFailures() || transform.hasFailures()) {
            status = RunStatus.COMPLETED_WITH_FAILURES;
        } else {
            status = RunStatus.COMPLETED;
        }

        RunSummary summary = new RunSummary(documentId, status, traversal.extractedEntities(), load.totals(),
            load.failures(), traversal.skippedEntities(), transform, traversal.abortReason(),
            Duration.ofNanos(System.nanoTime() - start));
        logger.info("Run for document {} {}: {} entities, {} nodes created, {} merged, {} relationships created, "
                + "{} merged, {} failed batches, {} skipped, {} derived relationships in {} ms",
            documentId, status, summary.extractedEntities(), summary.nodesCreated(), summary.nodesMerged(),
            summary.relationshipsCreated(), summary.relationshipsMerged(), summary.failedBatches().size(),
            summary.skippedEntities().size(), transform.derivedRelationships(), summary.elapsed().toMillis());
        return summary;
    }

    private void initializeStore() {
        try {
            store.initialize().get(settings.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphStoreUnavailableException("graph store", e);
        } catch (TimeoutException e) {
            throw new GraphStoreUnavailableException("graph store", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GraphStoreUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new GraphStoreUnavailableException("graph store", cause);
        }
    }
}
