package br.edu.ifba.cadgraph.load;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;

/**
 * Commits graph batches of one document.
 *
 * <p>Batches handed to {@link #submit(GraphBatch)} are committed on a single
 * background thread in submission order, so extraction can continue while the
 * store works. Each commit runs under the store call guard, on that same thread,
 * so no two commits of a document ever overlap; a batch that still
 * fails is recorded as a {@link BatchFailure} and loading continues with the
 * next batch. Nothing is ever deleted.</p>
 */
public class BatchLoader implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchLoader.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final GraphStore store;
    private final String documentId;
    private final StoreCallGuard storeGuard;
    private final ExecutorService commitExecutor;

    private final List<CompletableFuture<LoadResult>> pending = new ArrayList<>();
    private final List<BatchFailure> failures = new ArrayList<>();
    private CommitStats totals = CommitStats.EMPTY;
    private int committedBatches;
    private volatile boolean closed;

    public BatchLoader(@NotNull GraphStore store, @NotNull String documentId, @NotNull StoreCallGuard storeGuard) {
        this.store = store;
        this.documentId = documentId;
        this.storeGuard = storeGuard;
        this.commitExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cadgraph-loader-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queues a batch for commit.
     *
     * @return future completed with the batch's result; never completed exceptionally
     */
    public CompletableFuture<LoadResult> submit(@NotNull GraphBatch batch) {
        if (closed) {
            throw new IllegalStateException("Loader for document " + documentId + " is closed");
        }
        CompletableFuture<LoadResult> future = CompletableFuture.supplyAsync(() -> load(batch), commitExecutor);
        synchronized (pending) {
            pending.add(future);
        }
        return future;
    }

    /**
     * Commits a batch on the calling thread and records the outcome.
     */
    public LoadResult load(@NotNull GraphBatch batch) {
        if (batch.isEmpty()) {
            return LoadResult.committed(batch.sequence(), CommitStats.EMPTY);
        }
        try {
            CommitStats stats = commit(batch);
            record(stats);
            logger.debug("Batch {} committed for document {}: {} created, {} merged",
                batch.sequence(), documentId, stats.created(), stats.merged());
            return LoadResult.committed(batch.sequence(), stats);
        } catch (BatchLoadFailedException e) {
            BatchFailure failure = e.toFailure();
            logger.error("Batch {} for document {} abandoned after {} attempt(s): {}",
                batch.sequence(), documentId, failure.attempts(), failure.cause());
            synchronized (failures) {
                failures.add(failure);
            }
            return LoadResult.failed(failure);
        }
    }

    /**
     * Commits a batch under the store call guard without recording it.
     *
     * @throws BatchLoadFailedException if every attempt failed or the failure was permanent
     */
    public CommitStats commit(@NotNull GraphBatch batch) throws BatchLoadFailedException {
        try {
            return storeGuard.execute("upsertBatch#" + batch.sequence(),
                () -> store.upsertBatch(documentId, batch));
        } catch (RetryExhaustedException e) {
            throw new BatchLoadFailedException(batch, e);
        }
    }

    /**
     * Waits for every submitted batch and returns the totals.
     */
    public LoadReport awaitCompletion() {
        List<CompletableFuture<LoadResult>> snapshot;
        synchronized (pending) {
            snapshot = new ArrayList<>(pending);
        }
        CompletableFuture.allOf(snapshot.toArray(new CompletableFuture<?>[0])).join();
        return report();
    }

    public LoadReport report() {
        List<BatchFailure> failed;
        synchronized (failures) {
            failed = new ArrayList<>(failures);
        }
        failed.sort(Comparator.comparingLong(BatchFailure::sequence));
        synchronized (this) {
            return new LoadReport(committedBatches, totals, failed);
        }
    }

    @Override
    public void close() {
        closed = true;
        commitExecutor.shutdown();
        try {
            if (!commitExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Loader for document {} did not drain in time, forcing shutdown", documentId);
                commitExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            commitExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private synchronized void record(CommitStats stats) {
        totals = totals.plus(stats);
        committedBatches++;
    }
}
