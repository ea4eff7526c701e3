package com.air.pipeline;

import com.air.core.logging.MdcContext;
import com.air.core.metrics.AirMetrics;
import com.air.core.model.PatchRecord;
import com.air.core.model.ReviewRequest;
import com.air.core.model.ReviewStatus;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.queue.SnapshotTask;
import com.air.core.store.ReviewStore;
import com.air.core.store.StorageException;
import com.air.worktree.Preparation;
import com.air.worktree.PreparationException;
import com.air.worktree.PreparedPatch;
import com.air.worktree.Snapshot;
import com.air.worktree.SnapshotException;
import com.air.worktree.WorkTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Setup stage worker, permanently paired with one work tree.
 *
 * <p>For each claimed request: bind the tree, fetch and resolve the patch
 * commits, record the patch list, optionally index, then cut one snapshot
 * per selected patch in ascending order and hand each to the reviewers.
 * The tree is released as soon as the last snapshot is handed off.
 * Pushing to the bounded handoff queue is the only thing that slows this
 * worker down when reviewers fall behind.
 */
public class SetupWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SetupWorker.class);

    private final String name;
    private final WorkTree tree;
    private final ReviewQueue reviewQueue;
    private final ReviewStore store;
    private final SnapshotHandoffQueue handoff;
    private final AirMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private final Duration pollInterval;
    private volatile boolean running = true;

    public SetupWorker(int workerId, WorkTree tree, ReviewQueue reviewQueue, ReviewStore store,
                       SnapshotHandoffQueue handoff, AirMetrics metrics, FatalErrorHandler fatalErrorHandler,
                       Duration pollInterval) {
        this.name = "setup-" + workerId;
        this.tree = tree;
        this.reviewQueue = reviewQueue;
        this.store = store;
        this.handoff = handoff;
        this.metrics = metrics;
        this.fatalErrorHandler = fatalErrorHandler;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        MdcContext.setWorker(name);
        log.info("Setup worker started on {}", tree.name());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                var next = reviewQueue.claim(pollInterval);
                if (next.isEmpty()) {
                    continue;
                }
                try {
                    process(next.get());
                } catch (StorageException e) {
                    fatalErrorHandler.onFatal("setup of review " + next.get().id(), e);
                    return;
                } catch (RuntimeException e) {
                    log.error("Unexpected failure setting up review {}", next.get().id(), e);
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    failQuietly(next.get(), "Internal error during setup: " + e.getMessage());
                } finally {
                    MdcContext.clearReview();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (StorageException e) {
            fatalErrorHandler.onFatal("review queue", e);
        } finally {
            log.info("Setup worker stopped");
            MdcContext.clear();
        }
    }

    public void stop() {
        running = false;
    }

    /**
     * Runs one request through the setup stage.
     */
    void process(ReviewRequest request) throws InterruptedException {
        String id = request.id();
        MdcContext.setReview(id);
        long start = System.nanoTime();
        store.markSetupStarted(id);
        log.info("Setting up review {} on {}", id, tree.name());

        try (var lease = tree.bind(request.owner(), id)) {
            Preparation preparation;
            List<PreparedPatch> selected;
            try {
                preparation = lease.fetchAndPrepare(request);
                checkMask(request, preparation);
                selected = recordPatches(request, preparation);
                if (!selected.isEmpty()) {
                    lease.index(preparation.range());
                }
            } catch (PreparationException e) {
                abortIfInterrupted(id);
                log.warn("Preparation of review {} failed: {}", id, e.getMessage());
                fail(request, e.getMessage());
                metrics.recordSetupDuration(Duration.ofNanos(System.nanoTime() - start), false);
                return;
            }
            metrics.recordPatchCount(preparation.patchCount());

            for (var patch : selected) {
                Snapshot snapshot;
                try {
                    snapshot = lease.snapshot(patch.index(), patch.commit());
                } catch (SnapshotException e) {
                    abortIfInterrupted(id);
                    log.warn("Snapshot of patch {} failed: {}", patch.index(), e.getMessage());
                    metrics.recordSnapshotOperation("create_failed");
                    store.failPatch(id, patch.index(), e.getMessage(), 0);
                    continue;
                }
                metrics.recordSnapshotOperation("create");
                handOff(new SnapshotTask(id, patch.index(), patch.commit(), snapshot));
            }
        }

        var record = store.markSetupCompleted(id);
        metrics.recordSetupDuration(Duration.ofNanos(System.nanoTime() - start), true);
        if (record.status() == ReviewStatus.DONE) {
            metrics.recordReviewResult(ReviewStatus.DONE.label());
        }
        log.info("Setup complete for review {}", id);
    }

    private void handOff(SnapshotTask task) throws InterruptedException {
        try {
            handoff.push(task);
        } catch (InterruptedException e) {
            tree.snapshotter().delete(task.snapshot());
            metrics.recordSnapshotOperation("delete");
            throw e;
        }
        log.debug("Queued snapshot {} for patch {}", task.snapshot().id(), task.patchIndex());
    }

    /**
     * A git step killed by shutdown is not a failure of the review: it stays
     * in setup and is marked interrupted on the next start.
     */
    private static void abortIfInterrupted(String id) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Setup of review " + id + " interrupted");
        }
    }

    private static void checkMask(ReviewRequest request, Preparation preparation) throws PreparationException {
        var mask = request.mask();
        if (mask != null && mask.size() != preparation.patchCount()) {
            throw new PreparationException("Mask has " + mask.size() + " entries but the review has "
                    + preparation.patchCount() + " patches");
        }
    }

    private List<PreparedPatch> recordPatches(ReviewRequest request, Preparation preparation) {
        var records = new ArrayList<PatchRecord>();
        var selected = new ArrayList<PreparedPatch>();
        for (var patch : preparation.patches()) {
            if (request.isSelected(patch.index())) {
                records.add(PatchRecord.pending(patch.index(), patch.commit()));
                selected.add(patch);
            } else {
                records.add(PatchRecord.skipped(patch.index(), patch.commit()));
            }
            if (patch.input() != null) {
                store.writePatchInput(request.id(), patch.index(), patch.input());
            }
        }
        store.recordPatches(request.id(), records);
        log.info("Review {} has {} patch(es), {} selected", request.id(), records.size(), selected.size());
        return selected;
    }

    private void fail(ReviewRequest request, String message) {
        store.failRequest(request.id(), message);
        store.writeMessage(request.id(), message);
        metrics.recordReviewResult("error");
    }

    private void failQuietly(ReviewRequest request, String message) {
        try {
            fail(request, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of review {}", request.id(), e);
        }
    }
}
