package com.air.pipeline;

import com.air.core.logging.MdcContext;
import com.air.core.metrics.AirMetrics;
import com.air.core.model.ReviewFormat;
import com.air.core.model.ReviewRecord;
import com.air.core.model.ReviewStatus;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.queue.SnapshotTask;
import com.air.core.store.ReviewStore;
import com.air.core.store.StorageException;
import com.air.reviewer.ReviewFailureException;
import com.air.reviewer.ReviewJob;
import com.air.reviewer.ReviewTimeoutException;
import com.air.reviewer.ReviewerInvoker;
import com.air.worktree.Snapshotter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reviewer stage worker: pops one snapshot at a time, runs the reviewer on
 * it with bounded retries, records the patch outcome and deletes the
 * snapshot. The snapshot is deleted exactly once whatever happens.
 */
public class ReviewerWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReviewerWorker.class);

    private final String name;
    private final SnapshotHandoffQueue handoff;
    private final ReviewStore store;
    private final ReviewerInvoker reviewer;
    private final Snapshotter snapshotter;
    private final int maxAttempts;
    private final AirMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private final Duration pollInterval;
    private volatile boolean running = true;

    public ReviewerWorker(int workerId, SnapshotHandoffQueue handoff, ReviewStore store, ReviewerInvoker reviewer,
                          Snapshotter snapshotter, int maxAttempts, AirMetrics metrics,
                          FatalErrorHandler fatalErrorHandler, Duration pollInterval) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.name = "reviewer-" + workerId;
        this.handoff = handoff;
        this.store = store;
        this.reviewer = reviewer;
        this.snapshotter = snapshotter;
        this.maxAttempts = maxAttempts;
        this.metrics = metrics;
        this.fatalErrorHandler = fatalErrorHandler;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        MdcContext.setWorker(name);
        log.info("Reviewer worker started");
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                var next = handoff.poll(pollInterval);
                if (next.isEmpty()) {
                    continue;
                }
                try {
                    process(next.get());
                } catch (StorageException e) {
                    fatalErrorHandler.onFatal("review " + next.get().reviewId() + " patch " + next.get().patchIndex(), e);
                    return;
                } finally {
                    MdcContext.clearReview();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Reviewer worker stopped");
            MdcContext.clear();
        }
    }

    public void stop() {
        running = false;
    }

    /**
     * Reviews one snapshot and records the outcome. Deletes the snapshot on every path.
     */
    void process(SnapshotTask task) {
        MdcContext.setPatch(task.reviewId(), task.patchIndex());
        long start = System.nanoTime();
        try {
            var started = store.markReviewerStarted(task.reviewId(), task.patchIndex(), task.snapshot().id());
            if (started.status().isTerminal()) {
                log.warn("Review {} is already {}, dropping patch {}", task.reviewId(),
                        started.status().label(), task.patchIndex());
                return;
            }
            var job = new ReviewJob(task.reviewId(), task.patchIndex(), task.commit(), task.snapshot().path(),
                    store.patchDir(task.reviewId(), task.patchIndex()));

            ReviewFailureException last = null;
            int attempt = 1;
            for (; attempt <= maxAttempts; attempt++) {
                try {
                    reviewer.review(job, attempt);
                    metrics.recordReviewerAttempt("success");
                    last = null;
                    break;
                } catch (ReviewFailureException e) {
                    last = e;
                    metrics.recordReviewerAttempt(e instanceof ReviewTimeoutException ? "timeout" : "failure");
                    log.warn("Review attempt {}/{} of patch {} failed: {}", attempt, maxAttempts,
                            task.patchIndex(), e.getMessage());
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                }
            }

            if (last != null && Thread.currentThread().isInterrupted()) {
                // left non-terminal; the next start marks the review interrupted
                log.warn("Review of patch {} stopped by shutdown after {} attempt(s)", task.patchIndex(), attempt);
                metrics.recordPatchReview(Duration.ofNanos(System.nanoTime() - start), "interrupted");
                return;
            }

            ReviewRecord after;
            if (last == null) {
                after = store.completePatch(task.reviewId(), task.patchIndex(),
                        ReviewStore.resultPath(task.patchIndex(), ReviewFormat.JSON), attempt);
                metrics.recordPatchReview(Duration.ofNanos(System.nanoTime() - start), "done");
            } else {
                int attempts = Math.min(attempt, maxAttempts);
                log.error("Review of patch {} failed after {} attempt(s): {}", task.patchIndex(), attempts, last.getMessage());
                after = store.failPatch(task.reviewId(), task.patchIndex(), last.getMessage(), attempts);
                metrics.recordPatchReview(Duration.ofNanos(System.nanoTime() - start), "error");
            }
            if (after.status() == ReviewStatus.DONE) {
                metrics.recordReviewResult(ReviewStatus.DONE.label());
                log.info("Review {} complete{}", task.reviewId(),
                        after.message() == null ? "" : ": " + after.message());
            }
        } catch (RuntimeException e) {
            if (e instanceof StorageException) {
                throw e;
            }
            log.error("Unexpected failure reviewing patch {}", task.patchIndex(), e);
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            store.failPatch(task.reviewId(), task.patchIndex(), "Internal error: " + e.getMessage(), 0);
        } finally {
            snapshotter.delete(task.snapshot());
            metrics.recordSnapshotOperation("delete");
        }
    }
}
