package br.edu.ifba.cadgraph.transform;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;

/**
 * Runs the derivation passes over a loaded document and writes their edges.
 *
 * <p>Passes are independent: they may run concurrently, and a failing pass does
 * not stop the others. Within a pass, derived relationships are upserted in
 * batches of {@code batchSize}, one after another.</p>
 */
public class GraphTransformer {

    private static final Logger logger = LoggerFactory.getLogger(GraphTransformer.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final GraphStore store;
    private final StoreCallGuard storeGuard;
    private final TransformSettings settings;
    private final List<DerivationPass> passes;

    public GraphTransformer(@NotNull GraphStore store, @NotNull StoreCallGuard storeGuard,
            @NotNull TransformSettings settings, @NotNull List<DerivationPass> passes) {
        this.store = store;
        this.storeGuard = storeGuard;
        this.settings = settings;
        this.passes = List.copyOf(passes);
    }

    /**
     * Transformer with the timeline sequencing and adjacency passes.
     */
    public static GraphTransformer withDefaultPasses(@NotNull GraphStore store,
            @NotNull StoreCallGuard storeGuard, @NotNull TransformSettings settings) {
        return new GraphTransformer(store, storeGuard, settings,
            List.of(new TimelineSequencingPass(), new AdjacencyDerivationPass()));
    }

    public TransformReport transform(@NotNull String documentId) {
        if (!settings.enabled() || passes.isEmpty()) {
            logger.debug("Transformer disabled, no derived relationships for document {}", documentId);
            return TransformReport.SKIPPED;
        }
        DerivationContext context = new DerivationContext(store, documentId, storeGuard);
        List<PassResult> results = new ArrayList<>();

        if (!settings.parallel() || passes.size() == 1) {
            for (DerivationPass pass : passes) {
                results.add(runPass(pass, context));
            }
            return new TransformReport(results);
        }

        ExecutorService executor = Executors.newFixedThreadPool(passes.size(), runnable -> {
            Thread thread = new Thread(runnable, "cadgraph-transform-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<CompletableFuture<PassResult>> futures = passes.stream()
                .map(pass -> CompletableFuture.supplyAsync(() -> runPass(pass, context), executor))
                .toList();
            futures.forEach(future -> results.add(future.join()));
        } finally {
            executor.shutdown();
        }
        return new TransformReport(results);
    }

    private PassResult runPass(DerivationPass pass, DerivationContext context) {
        long start = System.nanoTime();
        int derived = 0;
        int batches = 0;
        CommitStats stats = CommitStats.EMPTY;
        try {
            List<GraphRelationship> relationships = pass.derive(context);
            derived = relationships.size();
            for (int from = 0; from < relationships.size(); from += settings.batchSize()) {
                List<GraphRelationship> chunk =
                    relationships.subList(from, Math.min(from + settings.batchSize(), relationships.size()));
                GraphBatch batch = GraphBatch.ofRelationships(batches + 1L, new ArrayList<>(chunk));
                stats = stats.plus(storeGuard.execute(pass.name() + "#" + batches,
                    () -> store.upsertBatch(context.documentId(), batch)));
                batches++;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            logger.info("Pass {} derived {} relationships for document {} in {} ms ({} created, {} merged)",
                pass.name(), derived, context.documentId(), elapsed.toMillis(), stats.created(), stats.merged());
            return new PassResult(pass.name(), derived, batches, stats, null, elapsed);
        } catch (RetryExhaustedException | RuntimeException e) {
            Throwable cause = e.getCause() != null && e instanceof RetryExhaustedException ? e.getCause() : e;
            logger.error("Pass {} failed for document {} after {} batch(es): {}",
                pass.name(), context.documentId(), batches, cause.getMessage(), e);
            return new PassResult(pass.name(), derived, batches, stats,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
