package com.air.dispatch.cli;

import com.air.core.model.Origin;
import com.air.core.model.ReviewFormat;
import com.air.core.model.ReviewRequest;
import com.air.core.model.ReviewStatus;
import com.air.core.model.ValidationException;
import com.air.pipeline.PipelineWorkers;
import com.air.pipeline.ReviewService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: air review --tree &lt;tree&gt; (--hash H | --series ID | --patch FILE...)
 * <p>
 * Submits one review, runs the pipeline in-process until the review is
 * terminal, then prints each patch's review.
 */
@Command(name = "review", mixinStandardHelpOptions = true,
        description = "Submit a review and wait for its results")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Option(names = {"--tree", "-t"}, required = true, description = "Source tree, e.g. netdev/net-next")
    private String tree;

    @Option(names = {"--branch", "-b"}, description = "Branch (default: the remote's HEAD)")
    private String branch;

    @Option(names = {"--owner"}, description = "Owner recorded on the review (default: ${DEFAULT-VALUE})",
            defaultValue = "${sys:user.name}")
    private String owner;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private OriginOptions origin;

    @Option(names = {"--mask"}, split = ",",
            description = "Per-patch selection, e.g. 1,0,1 (0 or false skips a patch)")
    private List<String> mask;

    @Option(names = {"--format", "-f"}, defaultValue = "markdown",
            description = "Result format: json, markdown, inline (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = {"--timeout"}, defaultValue = "120",
            description = "Minutes to wait for the review (default: ${DEFAULT-VALUE})")
    private int timeoutMinutes;

    static class OriginOptions {
        @Option(names = {"--hash"}, description = "Commit hash or range (a..b)")
        String hash;

        @Option(names = {"--series"}, description = "Patchwork series id")
        Long series;

        @Option(names = {"--patch", "-p"}, description = "Patch file to apply (repeatable, applied in order)")
        List<Path> patches;
    }

    private final ReviewService reviewService;
    private final PipelineWorkers workers;

    public ReviewCommand(ReviewService reviewService, PipelineWorkers workers) {
        this.reviewService = reviewService;
        this.workers = workers;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();

        ReviewRequest request;
        ReviewFormat resultFormat;
        try {
            resultFormat = ReviewFormat.fromLabel(format);
            request = ReviewRequest.create(owner, tree, branch, toOrigin(), parseMask(mask));
        } catch (ValidationException e) {
            ConsoleOutput.error("Invalid review: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read patch file: " + e.getMessage());
            return 2;
        }

        try {
            workers.start();
        } catch (IllegalStateException e) {
            ConsoleOutput.error("Pipeline failed to start: " + e.getMessage());
            return 1;
        }

        String id = reviewService.submit(request);
        ConsoleOutput.info("Submitted review " + id + " (" + request.origin().describe() + ")");

        var finished = reviewService.awaitTerminal(id, Duration.ofMinutes(timeoutMinutes), Duration.ofSeconds(1));
        if (finished.isEmpty()) {
            ConsoleOutput.error("Review " + id + " did not finish within " + timeoutMinutes + " minutes");
            return 1;
        }

        var record = finished.get();
        ConsoleOutput.review(record);
        ConsoleOutput.patches(record);
        var results = reviewService.results(id, resultFormat).orElse(List.of());
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) == null) {
                continue;
            }
            System.out.println();
            ConsoleOutput.info("Patch " + (i + 1) + " review:");
            System.out.println(results.get(i));
        }
        return record.status() == ReviewStatus.DONE ? 0 : 1;
    }

    private Origin toOrigin() throws IOException {
        if (origin.hash != null) {
            return Origin.ofHash(origin.hash);
        }
        if (origin.series != null) {
            return new Origin.Series(origin.series);
        }
        var bodies = new ArrayList<String>();
        for (Path file : origin.patches) {
            bodies.add(Files.readString(file, StandardCharsets.UTF_8));
        }
        return new Origin.LiteralPatches(bodies);
    }

    static List<Boolean> parseMask(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        var mask = new ArrayList<Boolean>(raw.size());
        for (String entry : raw) {
            switch (entry.trim().toLowerCase()) {
                case "1", "true", "y", "yes" -> mask.add(Boolean.TRUE);
                case "0", "false", "n", "no" -> mask.add(Boolean.FALSE);
                default -> throw new ValidationException("Invalid mask entry: " + entry);
            }
        }
        return mask;
    }
}
