package br.edu.ifba.cadgraph.load;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.core.GraphNode;
import br.edu.ifba.cadgraph.core.GraphRelationship;
import br.edu.ifba.cadgraph.core.NodeCategory;
import br.edu.ifba.cadgraph.core.RelationshipType;
import br.edu.ifba.cadgraph.storage.FailingGraphStore;
import br.edu.ifba.cadgraph.storage.GraphStore;
import br.edu.ifba.cadgraph.storage.impl.InMemoryGraphStore;
import br.edu.ifba.cadgraph.utils.RetryEventLogger;
import br.edu.ifba.cadgraph.utils.StoreCallGuard;
import br.edu.ifba.cadgraph.utils.TransientStoreFailurePredicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link BatchLoader}.
 */
class BatchLoaderTest {

    private static final String DOC = "doc-1";

    private InMemoryGraphStore inner;
    private FailingGraphStore store;
    private BatchLoader loader;

    @BeforeEach
    void setUp() {
        inner = new InMemoryGraphStore();
        inner.initialize().join();
        store = new FailingGraphStore(inner);
        loader = new BatchLoader(store, DOC, guard(Duration.ofSeconds(5)));
    }

    private static StoreCallGuard guard(Duration attemptTimeout) {
        return new StoreCallGuard(3, Duration.ofMillis(1), Duration.ofMillis(4), attemptTimeout,
            new TransientStoreFailurePredicate(), new RetryEventLogger());
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private static GraphBatch batch(long sequence, String... nodeIds) {
        final List<GraphNode> nodes = Arrays.stream(nodeIds)
            .map(id -> GraphNode.builder(id, "SketchPoint", NodeCategory.SKETCH_GEOMETRY).build())
            .toList();
        return new GraphBatch(sequence, nodes, List.of());
    }

    @Test
    @DisplayName("submitted batches are committed and totalled")
    void testSubmitAndAwait() {
        loader.submit(batch(1, "a", "b"));
        loader.submit(batch(2, "c"));
        loader.submit(new GraphBatch(3, List.of(), List.of(
            GraphRelationship.of("a", "c", RelationshipType.REFERENCES, Map.of()))));

        final LoadReport report = loader.awaitCompletion();

        assertEquals(3, report.committedBatches());
        assertEquals(3, report.totals().nodesCreated());
        assertEquals(1, report.totals().relationshipsCreated());
        assertFalse(report.hasFailures());
    }

    @Test
    @DisplayName("transient failures are retried until the commit succeeds")
    void testTransientFailureRetried() {
        store.failNextUpserts(2);

        final LoadResult result = loader.load(batch(1, "a"));

        assertFalse(result.failed());
        assertEquals(1, result.created());
        assertEquals(3, store.upsertCalls(), "Two failures then one success");
    }

    @Test
    @DisplayName("an exhausted batch is recorded and later batches still load")
    void testPartialFailureResilience() {
        store.failBatches(2L);

        loader.submit(batch(1, "a"));
        loader.submit(batch(2, "b", "c"));
        loader.submit(batch(3, "d"));
        final LoadReport report = loader.awaitCompletion();

        assertEquals(2, report.committedBatches());
        assertEquals(1, report.failures().size());
        final BatchFailure failure = report.failures().get(0);
        assertEquals(2, failure.sequence());
        assertEquals(3, failure.attempts());
        assertTrue(failure.transientFailure());
        assertEquals(List.of(new FailedEntity("SketchPoint", "b"), new FailedEntity("SketchPoint", "c")),
            failure.entities());

        assertNotNull(inner.getNode(DOC, "d").join(), "Batch after the failed one must be committed");
        assertNull(inner.getNode(DOC, "b").join(), "Failed batch must leave no trace");
    }

    @Test
    @DisplayName("permanent failures are not retried")
    void testPermanentFailureNotRetried() {
        store.failBatches(1L).withFailure(() -> new IllegalArgumentException("Cannot serialize node properties"));

        final LoadResult result = loader.load(batch(1, "a"));

        assertTrue(result.failed());
        assertEquals(1, store.upsertCalls());
        assertFalse(result.failure().transientFailure());
    }

    @Test
    @DisplayName("re-loading the same batch merges instead of creating")
    void testIdempotentReload() {
        loader.load(batch(1, "a", "b"));
        final LoadResult second = loader.load(batch(2, "a", "b"));

        assertEquals(0, second.created());
        assertEquals(2, second.merged());
    }

    @Test
    @DisplayName("a commit outliving its attempt timeout is not overlapped by a retry or the next batch")
    void testTimedOutCommitNotOverlapped() {
        store.delayNextUpserts(1, Duration.ofMillis(400));
        try (BatchLoader slowLoader = new BatchLoader(store, DOC, guard(Duration.ofMillis(100)))) {
            slowLoader.submit(batch(1, "a"));
            slowLoader.submit(batch(2, "b"));

            final LoadReport report = slowLoader.awaitCompletion();

            assertEquals(1, store.maxUpsertsInFlight(), "Store calls must never run concurrently");
            assertEquals(2, store.upsertCalls(), "The late commit of batch 1 is its result, not a reason to retry");
            assertEquals(2, report.committedBatches());
            assertEquals(2, report.totals().nodesCreated());
            assertEquals(0, report.totals().nodesMerged());
            assertFalse(report.hasFailures());
        }
    }

    @Test
    @DisplayName("a commit failing after its attempt timeout is retried once it has settled")
    void testLateFailureRetriedAfterSettling() {
        store.delayNextUpserts(1, Duration.ofMillis(300)).failNextUpserts(1);
        try (BatchLoader slowLoader = new BatchLoader(store, DOC, guard(Duration.ofMillis(50)))) {
            final LoadResult result = slowLoader.load(batch(1, "a"));

            assertFalse(result.failed());
            assertEquals(1, result.created());
            assertEquals(2, store.upsertCalls());
            assertEquals(1, store.maxUpsertsInFlight());
        }
    }
}
