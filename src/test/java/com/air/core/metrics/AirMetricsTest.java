package com.air.core.metrics;

import com.air.core.model.Origin;
import com.air.core.model.ReviewRequest;
import com.air.core.queue.ReviewQueue;
import com.air.core.queue.SnapshotHandoffQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AirMetricsTest {

    private SimpleMeterRegistry registry;
    private AirMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AirMetrics(registry);
    }

    @Test
    @DisplayName("recordReviewResult increments the counter for each status")
    void recordReviewResult() {
        metrics.recordReviewResult("done");
        metrics.recordReviewResult("done");
        metrics.recordReviewResult("error");

        assertEquals(2.0, registry.find("air.reviews.total").tag("status", "done").counter().count());
        assertEquals(1.0, registry.find("air.reviews.total").tag("status", "error").counter().count());
    }

    @Test
    @DisplayName("recordReviewerAttempt records by outcome tag")
    void recordReviewerAttempt() {
        metrics.recordReviewerAttempt("timeout");
        metrics.recordReviewerAttempt("success");

        assertNotNull(registry.find("air.reviewer.attempts").tag("outcome", "timeout").counter());
        assertNotNull(registry.find("air.reviewer.attempts").tag("outcome", "success").counter());
    }

    @Test
    @DisplayName("setup and patch durations create timers")
    void timers() {
        metrics.recordSetupDuration(Duration.ofSeconds(12), true);
        metrics.recordPatchReview(Duration.ofMinutes(3), "done");

        var setup = registry.find("air.setup.duration").tag("success", "true").timer();
        assertNotNull(setup);
        assertEquals(1, setup.count());
        assertEquals(1, registry.find("air.patch.duration").tag("state", "done").timer().count());
    }

    @Test
    @DisplayName("recordPatchCount feeds a distribution summary")
    void patchCount() {
        metrics.recordPatchCount(5);
        metrics.recordPatchCount(1);

        var summary = registry.find("air.review.patches").summary();
        assertEquals(2, summary.count());
        assertEquals(6.0, summary.totalAmount());
    }

    @Test
    @DisplayName("queue gauges follow queue sizes")
    void queueGauges(@TempDir Path dir) {
        var queue = new ReviewQueue(dir.resolve("queue.json"));
        var handoff = new SnapshotHandoffQueue(4);
        metrics.registerQueues(queue, handoff);

        queue.submit(ReviewRequest.create("alice", "net", null, new Origin.SingleCommit("abcd1234"), null));

        assertEquals(1.0, registry.find("air.queue.length").gauge().value());
        assertEquals(0.0, registry.find("air.handoff.depth").gauge().value());
    }
}
