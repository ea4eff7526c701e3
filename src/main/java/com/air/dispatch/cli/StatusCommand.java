package com.air.dispatch.cli;

import com.air.core.model.ReviewStatus;
import com.air.pipeline.ReviewService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: air status &lt;review-id&gt;
 * <p>
 * Reads the review record from the store and displays its status,
 * queue position and per-patch progress.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check review status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Review ID")
    private String reviewId;

    private final ReviewService reviewService;

    public StatusCommand(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var view = reviewService.status(reviewId);
        if (view.isEmpty()) {
            ConsoleOutput.error("Review not found: " + reviewId);
            return;
        }

        var record = view.get().record();
        ConsoleOutput.review(record);
        if (record.status() == ReviewStatus.QUEUED && view.get().queuePosition() >= 0) {
            ConsoleOutput.info("Queue position: " + view.get().queuePosition()
                    + " (" + view.get().patchesAhead() + " patches ahead)");
        }
        ConsoleOutput.patches(record);
        if (record.status() == ReviewStatus.ERROR && record.message() == null) {
            reviewService.message(reviewId).ifPresent(m -> ConsoleOutput.error(m.strip()));
        }
    }
}
