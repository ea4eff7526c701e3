package com.air.pipeline;

import com.air.core.metrics.AirMetrics;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.store.ReviewStore;
import com.air.reviewer.ReviewerInvoker;
import com.air.worktree.WorkTreePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts and stops the two worker pools: N setup workers, worker {@code i}
 * bound to work tree {@code i}, and M reviewer workers sharing the handoff
 * queue.
 */
public class PipelineWorkers {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorkers.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final WorkTreePool pool;
    private final ReviewQueue reviewQueue;
    private final ReviewStore store;
    private final SnapshotHandoffQueue handoff;
    private final ReviewerInvoker reviewer;
    private final int reviewerConcurrency;
    private final int maxAttempts;
    private final AirMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private final Duration pollInterval;

    private final List<SetupWorker> setupWorkers = new ArrayList<>();
    private final List<ReviewerWorker> reviewerWorkers = new ArrayList<>();
    private ExecutorService setupExecutor;
    private ExecutorService reviewerExecutor;

    public PipelineWorkers(WorkTreePool pool, ReviewQueue reviewQueue, ReviewStore store,
                           SnapshotHandoffQueue handoff, ReviewerInvoker reviewer, int reviewerConcurrency,
                           int maxAttempts, AirMetrics metrics, FatalErrorHandler fatalErrorHandler,
                           Duration pollInterval) {
        this.pool = pool;
        this.reviewQueue = reviewQueue;
        this.store = store;
        this.handoff = handoff;
        this.reviewer = reviewer;
        this.reviewerConcurrency = reviewerConcurrency;
        this.maxAttempts = maxAttempts;
        this.metrics = metrics;
        this.fatalErrorHandler = fatalErrorHandler;
        this.pollInterval = pollInterval;
    }

    /**
     * Probes snapshot support, creates the work trees, recovers reviews
     * interrupted by a previous shutdown, then starts all workers.
     *
     * @throws IllegalStateException if copy-on-write is required but unavailable,
     *                               or a work tree cannot be created
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        pool.snapshotter().probe();
        pool.initialize();
        int recovered = store.recoverInterrupted(reviewQueue::contains);
        if (recovered > 0) {
            log.warn("Marked {} interrupted review(s) as error", recovered);
        }
        metrics.registerQueues(reviewQueue, handoff);

        setupExecutor = Executors.newFixedThreadPool(pool.size(), new WorkerThreadFactory("air-setup-"));
        reviewerExecutor = Executors.newFixedThreadPool(reviewerConcurrency, new WorkerThreadFactory("air-reviewer-"));

        for (var tree : pool.trees()) {
            var worker = new SetupWorker(tree.id(), tree, reviewQueue, store, handoff, metrics,
                    fatalErrorHandler, pollInterval);
            setupWorkers.add(worker);
            setupExecutor.execute(worker);
        }
        for (int i = 1; i <= reviewerConcurrency; i++) {
            var worker = new ReviewerWorker(i, handoff, store, reviewer, pool.snapshotter(), maxAttempts,
                    metrics, fatalErrorHandler, pollInterval);
            reviewerWorkers.add(worker);
            reviewerExecutor.execute(worker);
        }
        log.info("Pipeline started: {} setup worker(s), {} reviewer worker(s), handoff capacity {}",
                pool.size(), reviewerConcurrency, handoff.capacity());
    }

    public synchronized boolean isRunning() {
        return setupExecutor != null && !setupExecutor.isShutdown();
    }

    /**
     * Stops all workers, interrupting blocked ones, and deletes snapshots
     * still waiting in the handoff queue.
     */
    public synchronized void shutdown() {
        if (!isRunning()) {
            return;
        }
        log.info("Stopping pipeline");
        setupWorkers.forEach(SetupWorker::stop);
        reviewerWorkers.forEach(ReviewerWorker::stop);
        setupExecutor.shutdownNow();
        reviewerExecutor.shutdownNow();
        awaitTermination(setupExecutor, "setup");
        awaitTermination(reviewerExecutor, "reviewer");

        var leftover = handoff.drain();
        for (var task : leftover) {
            pool.snapshotter().delete(task.snapshot());
            metrics.recordSnapshotOperation("delete");
        }
        if (!leftover.isEmpty()) {
            log.info("Deleted {} unreviewed snapshot(s)", leftover.size());
        }
        setupWorkers.clear();
        reviewerWorkers.clear();
    }

    public int setupConcurrency() {
        return pool.size();
    }

    public int reviewerConcurrency() {
        return reviewerConcurrency;
    }

    private static void awaitTermination(ExecutorService executor, String stage) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Some {} workers did not stop within {}s", stage, SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger threadCounter = new AtomicInteger();
        private final String prefix;

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
