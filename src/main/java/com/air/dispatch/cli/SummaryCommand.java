package com.air.dispatch.cli;

import com.air.core.model.ReviewStatus;
import com.air.pipeline.ReviewService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: air summary
 * <p>
 * Review counts by status, queue length and configured concurrency.
 */
@Command(name = "summary", mixinStandardHelpOptions = true, description = "Show review counts and queue state")
@Component
public class SummaryCommand implements Runnable {

    private final ReviewService reviewService;

    public SummaryCommand(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var summary = reviewService.summary();
        for (var status : ReviewStatus.values()) {
            System.out.printf("  %-18s %d%n", status.label(), summary.reviews().count(status));
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info("Queued requests: " + summary.queueLength());
        ConsoleOutput.info("Snapshots awaiting review: " + summary.handoffDepth() + "/" + summary.handoffCapacity());
        ConsoleOutput.info("Workers: " + summary.setupConcurrency() + " setup, "
                + summary.reviewerConcurrency() + " reviewer");
    }
}
