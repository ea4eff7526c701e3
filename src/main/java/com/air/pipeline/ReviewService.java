package com.air.pipeline;

import com.air.core.metrics.AirMetrics;
import com.air.core.model.PatchRecord;
import com.air.core.model.PatchState;
import com.air.core.model.ReviewFormat;
import com.air.core.model.ReviewRecord;
import com.air.core.model.ReviewRequest;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import com.air.core.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Submission and query boundary of the pipeline. Queries read the store
 * directly and never wait on the workers.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final ReviewStore store;
    private final SnapshotHandoffQueue handoff;
    private final PipelineWorkers workers;
    private final AirMetrics metrics;

    public ReviewService(ReviewQueue reviewQueue, ReviewStore store, SnapshotHandoffQueue handoff,
                         PipelineWorkers workers, AirMetrics metrics) {
        this.reviewQueue = reviewQueue;
        this.store = store;
        this.handoff = handoff;
        this.workers = workers;
        this.metrics = metrics;
    }

    /**
     * Records and enqueues a validated request.
     *
     * @return the review id
     */
    public String submit(ReviewRequest request) {
        store.create(request);
        reviewQueue.submit(request);
        metrics.recordSubmission(originKind(request));
        log.info("Accepted review {} from {}: {}", request.id(), request.owner(), request.origin().describe());
        return request.id();
    }

    public Optional<ReviewRecord> get(String id) {
        return store.get(id);
    }

    public Optional<ReviewStatusView> status(String id) {
        return store.get(id).map(record -> new ReviewStatusView(record,
                reviewQueue.positionOf(id), reviewQueue.patchesAhead(id)));
    }

    /**
     * One entry per patch in index order: the review text in {@code format},
     * or {@code null} for skipped, failed or missing results.
     */
    public Optional<List<String>> results(String id, ReviewFormat format) {
        return store.get(id).map(record -> {
            var results = new ArrayList<String>();
            record.patches().stream()
                    .sorted(Comparator.comparingInt(PatchRecord::index))
                    .forEach(p -> results.add(p.state() == PatchState.DONE
                            ? store.readReviewFile(id, p.index(), format).orElse(null)
                            : null));
            return results;
        });
    }

    public Optional<String> message(String id) {
        return store.readMessage(id);
    }

    public List<ReviewRecord> list(String owner, int limit) {
        return store.list(owner, limit);
    }

    public PipelineSummary summary() {
        return new PipelineSummary(store.summary(), reviewQueue.length(), handoff.size(), handoff.capacity(),
                workers.setupConcurrency(), workers.reviewerConcurrency());
    }

    /**
     * Polls the store until the review is terminal.
     *
     * @return the terminal record, or empty if {@code timeout} elapsed first
     */
    public Optional<ReviewRecord> awaitTerminal(String id, Duration timeout, Duration pollInterval)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            var record = store.get(id);
            if (record.isPresent() && record.get().status().isTerminal()) {
                return record;
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    private static String originKind(ReviewRequest request) {
        return request.origin().getClass().getSimpleName();
    }
}
