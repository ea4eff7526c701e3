package com.air.reviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the reviewer as a subprocess inside the snapshot.
 *
 * <p>The command is a template; {@code {prompt}}, {@code {workdir}} and
 * {@code {model}} are substituted in every argument. Standard output is
 * written straight to {@code review.json} in the patch directory. Failed
 * attempts leave their diagnostics next to it:
 * {@code reviewer-stderr-attempt<k>.txt}, {@code timeout-info-attempt<k>.txt},
 * {@code review-partial-attempt<k>.json}.
 */
public class CommandLineReviewer implements ReviewerInvoker {

    private static final Logger log = LoggerFactory.getLogger(CommandLineReviewer.class);

    static final String REVIEW_JSON = "review.json";
    static final String REVIEW_MARKDOWN = "review.md";
    static final String REVIEW_INLINE = "review-inline.txt";

    private final List<String> commandTemplate;
    private final String model;
    private final Path promptDir;
    private final String promptFile;
    private final Duration timeout;
    private final StreamJsonConverter converter;

    /**
     * @param promptDir  directory copied into each snapshot before the run; may be {@code null}
     * @param promptFile prompt path relative to {@code promptDir}, or used as-is when there is no prompt directory
     */
    public CommandLineReviewer(List<String> commandTemplate, String model, Path promptDir, String promptFile,
                               Duration timeout, StreamJsonConverter converter) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("reviewer command must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.model = model;
        this.promptDir = promptDir;
        this.promptFile = promptFile == null ? "" : promptFile;
        this.timeout = timeout;
        this.converter = converter;
    }

    @Override
    public ReviewOutcome review(ReviewJob job, int attempt) throws ReviewFailureException {
        Path out = job.outputDir();
        Path reviewJson = out.resolve(REVIEW_JSON);
        Path stderrFile = out.resolve("reviewer-stderr-attempt" + attempt + ".txt");

        List<String> command;
        try {
            Files.createDirectories(out);
            command = buildCommand(job.workDir(), installPrompt(job.workDir()));
        } catch (IOException e) {
            throw new ReviewExecutionException("Failed to prepare reviewer run: " + e.getMessage(), e);
        }

        log.info("Reviewing patch {} ({}) attempt {}", job.patchIndex(), shortCommit(job.commit()), attempt);
        log.debug("Reviewer command: {}", command);
        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(job.workDir().toFile())
                    .redirectOutput(reviewJson.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            writeQuietly(out.resolve("error-attempt" + attempt + ".txt"),
                    "Attempt: " + attempt + "\nError: " + e.getMessage() + "\n");
            throw new ReviewExecutionException("Failed to start reviewer: " + e.getMessage(), e);
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ReviewExecutionException("Interrupted while waiting for reviewer", e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (!finished) {
            process.destroyForcibly();
            awaitExit(process);
            log.warn("Reviewer timed out on patch {} after {}s (attempt {})", job.patchIndex(), timeout.toSeconds(), attempt);
            writeQuietly(out.resolve("timeout-info-attempt" + attempt + ".txt"),
                    "Attempt: " + attempt + "\n"
                            + "Reviewer timed out after " + timeout.toSeconds() + " seconds\n"
                            + "Command: " + String.join(" ", command) + "\n"
                            + "Working directory: " + job.workDir() + "\n"
                            + stderrSection(stderrFile));
            deleteQuietly(stderrFile);
            savePartialOutput(out, reviewJson, attempt);
            throw new ReviewTimeoutException(timeout);
        }

        int exit = process.exitValue();
        if (exit != 0) {
            String stderr = readQuietly(stderrFile).strip();
            log.warn("Reviewer exited with {} on patch {} after {}ms (attempt {}): {}",
                    exit, job.patchIndex(), elapsed.toMillis(), attempt, stderr);
            savePartialOutput(out, reviewJson, attempt);
            throw new ReviewExecutionException("Reviewer exited with code " + exit
                    + (stderr.isEmpty() ? "" : ": " + firstLine(stderr)));
        }
        deleteQuietly(stderrFile);

        copyInlineReview(job.workDir(), out);
        try {
            converter.convert(reviewJson, out.resolve(REVIEW_MARKDOWN));
        } catch (IOException e) {
            throw new ReviewExecutionException("Failed to convert review output: " + e.getMessage(), e);
        }
        log.info("Reviewed patch {} in {}ms", job.patchIndex(), elapsed.toMillis());
        return new ReviewOutcome(out.resolve(REVIEW_MARKDOWN), elapsed);
    }

    List<String> buildCommand(Path workDir, String prompt) {
        return commandTemplate.stream()
                .map(arg -> arg.replace("{prompt}", prompt)
                        .replace("{workdir}", workDir.toString())
                        .replace("{model}", model == null ? "" : model))
                .toList();
    }

    /**
     * Copies the prompt directory into the snapshot, replacing a copy left by an
     * earlier attempt.
     *
     * @return path of the prompt file as the reviewer should see it
     */
    private String installPrompt(Path workDir) throws IOException {
        if (promptDir == null) {
            return promptFile;
        }
        Path target = workDir.resolve(promptDir.getFileName().toString());
        FileSystemUtils.deleteRecursively(target);
        FileSystemUtils.copyRecursively(promptDir, target);
        Path prompt = target.resolve(promptFile);
        if (!Files.exists(prompt)) {
            log.warn("Prompt file not found in snapshot: {}", prompt);
        }
        return prompt.toString();
    }

    private void savePartialOutput(Path out, Path reviewJson, int attempt) {
        try {
            if (!Files.exists(reviewJson)) {
                return;
            }
            if (Files.size(reviewJson) > 0) {
                Path partial = out.resolve("review-partial-attempt" + attempt + ".json");
                Files.copy(reviewJson, partial, StandardCopyOption.REPLACE_EXISTING);
                converter.convert(partial, out.resolve("review-partial-attempt" + attempt + ".md"));
                log.info("Partial reviewer output saved to {}", partial);
            }
            Files.delete(reviewJson);
        } catch (IOException e) {
            log.warn("Could not save partial reviewer output for attempt {}: {}", attempt, e.getMessage());
        }
    }

    private static void copyInlineReview(Path workDir, Path out) {
        Path inline = workDir.resolve(REVIEW_INLINE);
        if (!Files.exists(inline)) {
            return;
        }
        try {
            Files.copy(inline, out.resolve(REVIEW_INLINE), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to copy {}: {}", REVIEW_INLINE, e.getMessage());
        }
    }

    private static String stderrSection(Path stderrFile) {
        String stderr = readQuietly(stderrFile);
        return stderr.isBlank() ? "" : "\nStderr output:\n" + stderr + "\n";
    }

    private static void awaitExit(Process process) {
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }

    private static String shortCommit(String commit) {
        return commit != null && commit.length() > 12 ? commit.substring(0, 12) : commit;
    }

    private static String readQuietly(Path file) {
        try {
            return Files.exists(file) ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void writeQuietly(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not write {}: {}", file, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
