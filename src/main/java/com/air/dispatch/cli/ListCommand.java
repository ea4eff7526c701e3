package com.air.dispatch.cli;

import com.air.pipeline.ReviewService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: air list [--owner NAME] [--limit N]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List recent reviews")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--owner", "-o"}, description = "Only reviews of this owner")
    private String owner;

    @Option(names = {"--limit", "-n"}, defaultValue = "50", description = "Maximum entries (default: ${DEFAULT-VALUE})")
    private int limit;

    private final ReviewService reviewService;

    public ListCommand(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var reviews = reviewService.list(owner, limit);
        if (reviews.isEmpty()) {
            ConsoleOutput.info("No reviews found.");
            return;
        }

        System.out.printf("%-36s  %-12s %-18s %-7s %s%n", "REVIEW", "OWNER", "STATUS", "PATCHES", "SUBMITTED");
        System.out.println("-".repeat(100));
        for (var r : reviews) {
            System.out.printf("%-36s  %-12s %-18s %-7d %s%n",
                    r.id(), ConsoleOutput.truncate(r.owner(), 12), r.status().label(), r.patchCount(), r.submitted());
        }
    }
}
