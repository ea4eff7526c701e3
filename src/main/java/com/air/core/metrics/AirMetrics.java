package com.air.core.metrics;

import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the review pipeline.
 */
@Service
public class AirMetrics {

    private final MeterRegistry registry;

    public AirMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmission(String origin) {
        Counter.builder("air.reviews.submitted")
                .tag("origin", origin)
                .register(registry)
                .increment();
    }

    public void recordReviewResult(String status) {
        Counter.builder("air.reviews.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSetupDuration(Duration duration, boolean success) {
        Timer.builder("air.setup.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(duration);
    }

    public void recordPatchCount(int patches) {
        DistributionSummary.builder("air.review.patches")
                .description("Patches per prepared review")
                .register(registry)
                .record(patches);
    }

    /**
     * @param outcome "success", "timeout" or "failure"
     */
    public void recordReviewerAttempt(String outcome) {
        Counter.builder("air.reviewer.attempts")
                .description("Reviewer subprocess attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPatchReview(Duration duration, String state) {
        Timer.builder("air.patch.duration")
                .tag("state", state)
                .register(registry)
                .record(duration);
    }

    /**
     * @param operation "create", "delete" or "create_failed"
     */
    public void recordSnapshotOperation(String operation) {
        Counter.builder("air.snapshots")
                .description("Snapshot lifecycle operations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void registerQueues(ReviewQueue reviewQueue, SnapshotHandoffQueue handoffQueue) {
        Gauge.builder("air.queue.length", reviewQueue, ReviewQueue::length)
                .description("Review requests waiting for setup")
                .register(registry);
        Gauge.builder("air.handoff.depth", handoffQueue, SnapshotHandoffQueue::size)
                .description("Snapshots waiting for a reviewer")
                .register(registry);
    }
}
