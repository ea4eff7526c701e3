package com.air.worktree;

import com.air.core.model.Origin;
import com.air.core.model.ReviewRequest;
import com.air.series.SeriesSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brings a work tree to the state a review needs: remote added and fetched,
 * patch commits resolved or created, optional index built.
 */
public class TreePreparer {

    private static final Logger log = LoggerFactory.getLogger(TreePreparer.class);

    private final GitRunner git;
    private final RemoteResolver remotes;
    private final SeriesSource seriesSource;
    private final List<String> indexCommand;
    private final Duration indexTimeout;

    /**
     * @param seriesSource may be {@code null}; series requests then fail preparation
     * @param indexCommand command template with a {@code {range}} placeholder; empty disables indexing
     */
    public TreePreparer(GitRunner git, RemoteResolver remotes, SeriesSource seriesSource,
                        List<String> indexCommand, Duration indexTimeout) {
        this.git = git;
        this.remotes = remotes;
        this.seriesSource = seriesSource;
        this.indexCommand = indexCommand == null ? List.of() : List.copyOf(indexCommand);
        this.indexTimeout = indexTimeout;
    }

    public Preparation prepare(Path tree, ReviewRequest request) throws PreparationException {
        String remote = ensureRemote(tree, request.tree());
        check(git.git(tree, "fetch", remote), "Failed to fetch remote " + remote);
        String branch = request.branch() != null ? request.branch() : defaultBranch(tree, remote);
        log.info("Preparing {} for review {} ({} on {}/{})", tree.getFileName(), request.id(),
                request.origin().describe(), remote, branch);

        Origin origin = request.origin();
        if (origin instanceof Origin.SingleCommit commit) {
            return fromRange(tree, commit.hash() + "^.." + commit.hash(), commit.hash());
        }
        if (origin instanceof Origin.CommitRange range) {
            return fromRange(tree, range.range(), range.start());
        }

        List<String> bodies;
        if (origin instanceof Origin.Series series) {
            bodies = List.of(fetchSeries(series.seriesId()));
        } else {
            bodies = ((Origin.LiteralPatches) origin).bodies();
        }
        return applyPatches(tree, remote + "/" + branch, bodies);
    }

    /**
     * Runs the configured index command over {@code range}; no-op when none is configured.
     */
    public void index(Path tree, String range) throws PreparationException {
        if (indexCommand.isEmpty()) {
            return;
        }
        var command = indexCommand.stream().map(arg -> arg.replace("{range}", range)).toList();
        log.info("Indexing {} for range {}", tree.getFileName(), range);
        var result = git.run(tree, indexTimeout, command);
        if (!result.succeeded()) {
            throw new PreparationException("Indexing failed: " + result.diagnostic());
        }
    }

    // --- remote handling ---

    String ensureRemote(Path tree, String treeName) throws PreparationException {
        String name = remotes.remoteName(treeName);
        if (!git.git(tree, "remote", "get-url", name).succeeded()) {
            check(git.git(tree, "remote", "add", name, remotes.url(treeName)),
                    "Failed to add remote " + name);
        }
        return name;
    }

    String defaultBranch(Path tree, String remote) throws PreparationException {
        var symbolic = git.git(tree, "symbolic-ref", "refs/remotes/" + remote + "/HEAD");
        if (symbolic.succeeded() && !symbolic.stdout().isBlank()) {
            String ref = symbolic.stdout().strip();
            return ref.substring(ref.lastIndexOf('/') + 1);
        }
        var show = git.git(tree, "remote", "show", remote);
        if (show.succeeded()) {
            for (String line : show.stdout().split("\n")) {
                if (line.contains("HEAD branch:")) {
                    return line.substring(line.indexOf(':') + 1).strip();
                }
            }
        }
        throw new PreparationException("Failed to determine default branch for " + remote);
    }

    // --- origins ---

    private Preparation fromRange(Path tree, String range, String mustExist) throws PreparationException {
        if (!git.git(tree, "cat-file", "-e", mustExist + "^{commit}").succeeded()) {
            throw new PreparationException("Commit " + mustExist + " not found");
        }
        var commits = revList(tree, range);
        if (commits.isEmpty()) {
            throw new PreparationException("Range " + range + " contains no commits");
        }
        // snapshots reset from here, so each copy only rewrites what differs from the series tip
        String tip = commits.get(commits.size() - 1);
        check(git.git(tree, "reset", "--hard", "-q", tip), "Failed to check out " + tip);
        var patches = new ArrayList<PreparedPatch>(commits.size());
        for (int i = 0; i < commits.size(); i++) {
            String commit = commits.get(i);
            var formatted = git.git(tree, "format-patch", "-1", "--stdout", commit);
            if (!formatted.succeeded()) {
                log.warn("Could not format patch for {}: {}", commit, formatted.diagnostic());
            }
            patches.add(new PreparedPatch(i + 1, commit, formatted.succeeded() ? formatted.stdout() : null));
        }
        return new Preparation(patches, range);
    }

    private String fetchSeries(long seriesId) throws PreparationException {
        if (seriesSource == null) {
            throw new PreparationException("Patchwork not configured");
        }
        try {
            return seriesSource.fetchMbox(seriesId);
        } catch (IOException e) {
            throw new PreparationException("Failed to fetch patchwork series " + seriesId + ": " + e.getMessage(), e);
        }
    }

    private Preparation applyPatches(Path tree, String base, List<String> bodies) throws PreparationException {
        check(git.git(tree, "reset", "--hard", "-q", base), "Failed to reset to " + base);

        var patches = new ArrayList<PreparedPatch>();
        for (int i = 0; i < bodies.size(); i++) {
            String body = bodies.get(i);
            String headBefore = check(git.git(tree, "rev-parse", "HEAD"), "Failed to resolve HEAD").stdout().strip();

            Path patchFile = writePatchFile(body);
            try {
                var am = git.git(tree, "-c", "user.name=air", "-c", "user.email=air@localhost",
                        "am", patchFile.toString());
                if (!am.succeeded()) {
                    git.git(tree, "am", "--abort");
                    throw new PreparationException("Failed to apply patch " + (i + 1) + ": " + am.stderr().strip());
                }
            } finally {
                deletePatchFile(patchFile);
            }

            var created = revList(tree, headBefore + "..HEAD");
            if (created.isEmpty()) {
                throw new PreparationException("Patch " + (i + 1) + " did not create any commit");
            }
            for (String commit : created) {
                patches.add(new PreparedPatch(patches.size() + 1, commit, body));
            }
        }
        return new Preparation(patches, base + "..HEAD");
    }

    // --- helpers ---

    private List<String> revList(Path tree, String range) throws PreparationException {
        var result = check(git.git(tree, "rev-list", "--reverse", range), "Failed to list commits in " + range);
        return Arrays.stream(result.stdout().split("\n"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static CommandResult check(CommandResult result, String message) throws PreparationException {
        if (!result.succeeded()) {
            throw new PreparationException(message + ": " + result.diagnostic());
        }
        return result;
    }

    private static Path writePatchFile(String body) throws PreparationException {
        try {
            Path file = Files.createTempFile("air-", ".patch");
            Files.writeString(file, body, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new PreparationException("Failed to write patch file: " + e.getMessage(), e);
        }
    }

    private static void deletePatchFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
