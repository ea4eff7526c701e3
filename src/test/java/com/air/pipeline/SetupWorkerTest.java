package com.air.pipeline;

import com.air.core.metrics.AirMetrics;
import com.air.core.model.Origin;
import com.air.core.model.PatchState;
import com.air.core.model.ReviewRequest;
import com.air.core.model.ReviewStatus;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.queue.SnapshotTask;
import com.air.core.store.ReviewStore;
import com.air.worktree.PreparationException;
import com.air.worktree.WorkTree;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SetupWorkerTest {

    @TempDir
    Path dir;

    private ReviewStore store;
    private ReviewQueue queue;
    private SnapshotHandoffQueue handoff;
    private RecordingSnapshotter snapshotter;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new ReviewStore(dir.resolve("results"));
        queue = new ReviewQueue(dir.resolve("results").resolve("queue.json"));
        handoff = new SnapshotHandoffQueue(16);
        snapshotter = new RecordingSnapshotter(dir.resolve("snapshots"));
        registry = new SimpleMeterRegistry();
    }

    private WorkTree tree(ScriptedPreparer preparer) {
        return new WorkTree(1, dir.resolve("wt-1"), preparer, snapshotter);
    }

    private SetupWorker worker(WorkTree tree) {
        return new SetupWorker(1, tree, queue, store, handoff, new AirMetrics(registry),
                (context, error) -> fail("unexpected fatal error in " + context), Duration.ofMillis(50));
    }

    private ReviewRequest submitted(List<Boolean> mask) {
        var request = ReviewRequest.create("alice", "netdev/net", null, new Origin.CommitRange("v1..v2"), mask);
        store.create(request);
        return request;
    }

    private List<Integer> handedOffIndexes() {
        var indexes = new ArrayList<Integer>();
        for (SnapshotTask task : handoff.drain()) {
            indexes.add(task.patchIndex());
        }
        return indexes;
    }

    @Nested
    @DisplayName("Successful setup")
    class Success {

        @Test
        @DisplayName("hands off one snapshot per selected patch in order and releases the tree")
        void handsOffSelectedPatches() throws Exception {
            var preparer = ScriptedPreparer.commits(3);
            var tree = tree(preparer);
            var request = submitted(List.of(true, false, true));

            worker(tree).process(request);

            assertEquals(List.of(1, 3), handedOffIndexes());
            assertFalse(tree.isBound());
            var record = store.get(request.id()).orElseThrow();
            assertEquals(ReviewStatus.SETUP_IN_PROGRESS, record.status());
            assertNotNull(record.setupCompleted());
            assertEquals(PatchState.PENDING, record.patch(1).state());
            assertEquals(PatchState.SKIPPED, record.patch(2).state());
            assertEquals(PatchState.PENDING, record.patch(3).state());
            assertEquals(List.of("c0..c3"), preparer.indexedRanges);
            assertTrue(Files.isRegularFile(store.reviewDir(request.id()).resolve("2").resolve("patch")));
        }

        @Test
        @DisplayName("a mask on an mbox applies to each commit the mbox produced")
        void maskOverMbox() throws Exception {
            var mbox = new Origin.LiteralPatches(List.of("From c1\nSubject: [PATCH 1/3]\n\nFrom c2\n\nFrom c3\n"));
            var request = ReviewRequest.create("alice", "netdev/net", null, mbox, List.of(true, false, true));
            store.create(request);

            worker(tree(ScriptedPreparer.commits(3))).process(request);

            assertEquals(List.of(1, 3), handedOffIndexes());
            assertEquals(PatchState.SKIPPED, store.get(request.id()).orElseThrow().patch(2).state());
        }

        @Test
        @DisplayName("a fully masked review completes without reviewing or indexing")
        void allMasked() throws Exception {
            var preparer = ScriptedPreparer.commits(2);
            var request = submitted(List.of(false, false));

            worker(tree(preparer)).process(request);

            assertEquals(ReviewStatus.DONE, store.get(request.id()).orElseThrow().status());
            assertTrue(handedOffIndexes().isEmpty());
            assertTrue(preparer.indexedRanges.isEmpty());
            assertEquals(1.0, registry.counter("air.reviews.total", "status", "done").count());
        }

        @Test
        @DisplayName("a failed snapshot fails only its patch")
        void snapshotFailure() throws Exception {
            snapshotter.failOn(2);
            var request = submitted(null);

            worker(tree(ScriptedPreparer.commits(3))).process(request);

            assertEquals(List.of(1, 3), handedOffIndexes());
            var patch = store.get(request.id()).orElseThrow().patch(2);
            assertEquals(PatchState.ERROR, patch.state());
            assertEquals(0, patch.attempts());
            assertTrue(patch.error().contains("No space left on device"));
        }
    }

    @Nested
    @DisplayName("Failed setup")
    class Failure {

        @Test
        @DisplayName("preparation failure fails the review with its message and releases the tree")
        void preparationFails() throws Exception {
            var tree = tree(ScriptedPreparer.failing("Failed to apply patch 2: patch does not apply"));
            var request = submitted(null);

            worker(tree).process(request);

            var record = store.get(request.id()).orElseThrow();
            assertEquals(ReviewStatus.ERROR, record.status());
            assertEquals(0, record.patchCount());
            assertEquals("Failed to apply patch 2: patch does not apply", record.message());
            assertEquals(record.message(), store.readMessage(request.id()).orElseThrow());
            assertFalse(tree.isBound());
            assertEquals(0, handoff.size());
            assertTrue(snapshotter.created.isEmpty());
        }

        @Test
        @DisplayName("a git step killed by shutdown leaves the review in setup for restart recovery")
        void interruptedPreparation() throws Exception {
            var tree = tree(new ScriptedPreparer(r -> {
                Thread.currentThread().interrupt();
                throw new PreparationException("Failed to fetch remote netdev-net: interrupted");
            }));
            var request = submitted(null);

            try {
                assertThrows(InterruptedException.class, () -> worker(tree).process(request));
            } finally {
                Thread.interrupted();
            }

            var record = store.get(request.id()).orElseThrow();
            assertEquals(ReviewStatus.SETUP_IN_PROGRESS, record.status());
            assertNull(record.message());
            assertTrue(store.readMessage(request.id()).isEmpty());
            assertFalse(tree.isBound());
        }

        @Test
        @DisplayName("a mask that does not match the resolved patch count fails the review")
        void maskMismatch() throws Exception {
            var request = submitted(List.of(true, false));

            worker(tree(ScriptedPreparer.commits(3))).process(request);

            var record = store.get(request.id()).orElseThrow();
            assertEquals(ReviewStatus.ERROR, record.status());
            assertEquals("Mask has 2 entries but the review has 3 patches", record.message());
        }
    }

    @Test
    @DisplayName("run claims queued requests until stopped")
    void runLoop() throws Exception {
        var tree = tree(ScriptedPreparer.commits(1));
        var worker = worker(tree);
        var request = submitted(null);
        queue.submit(request);

        var thread = new Thread(worker);
        thread.start();
        var task = handoff.poll(Duration.ofSeconds(10));
        worker.stop();
        thread.join(5000);

        assertTrue(task.isPresent());
        assertEquals(request.id(), task.get().reviewId());
        assertFalse(thread.isAlive());
        assertEquals(0, queue.length());
    }
}
