package com.air.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Snapshots a work tree with {@code cp -a --reflink=<mode>} and resets the
 * copy to the patch commit. Work trees are self-contained clones, so the
 * copy carries its own {@code .git} and resetting it never touches the
 * live tree.
 */
public class CopyOnWriteSnapshotter implements Snapshotter {

    private static final Logger log = LoggerFactory.getLogger(CopyOnWriteSnapshotter.class);

    private final GitRunner runner;
    private final Path snapshotRoot;
    private final ReflinkMode mode;
    private final boolean keep;

    public CopyOnWriteSnapshotter(GitRunner runner, Path snapshotRoot, ReflinkMode mode, boolean keep) {
        this.runner = runner;
        this.snapshotRoot = snapshotRoot;
        this.mode = mode;
        this.keep = keep;
    }

    @Override
    public void probe() {
        if (mode != ReflinkMode.ALWAYS) {
            return;
        }
        Path source = snapshotRoot.resolve(".reflink-probe");
        Path copy = snapshotRoot.resolve(".reflink-probe.copy");
        try {
            Files.createDirectories(snapshotRoot);
            Files.writeString(source, "probe");
            var result = runner.run(snapshotRoot, runner.defaultTimeout(),
                    List.of("cp", mode.cpFlag(), source.toString(), copy.toString()));
            if (!result.succeeded()) {
                throw new IllegalStateException("Copy-on-write copies are not supported under "
                        + snapshotRoot + ": " + result.diagnostic()
                        + " (set air.snapshot.reflink=auto to allow full copies)");
            }
            log.info("Copy-on-write snapshots available under {}", snapshotRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot prepare snapshot directory " + snapshotRoot, e);
        } finally {
            deleteDirectory(source);
            deleteDirectory(copy);
        }
    }

    @Override
    public Snapshot create(Path tree, String reviewId, int patchIndex, String commit) throws SnapshotException {
        String id = reviewId + "-" + patchIndex + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path dest = snapshotRoot.resolve(id);
        try {
            Files.createDirectories(snapshotRoot);
        } catch (IOException e) {
            throw new SnapshotException("Cannot create snapshot directory " + snapshotRoot + ": " + e.getMessage());
        }

        var copy = runner.run(snapshotRoot, runner.defaultTimeout(),
                List.of("cp", "-a", mode.cpFlag(), tree.toString(), dest.toString()));
        if (!copy.succeeded()) {
            deleteDirectory(dest);
            throw new SnapshotException("Failed to copy work tree: " + copy.diagnostic());
        }

        var reset = runner.git(dest, "reset", "--hard", "-q", commit);
        if (!reset.succeeded()) {
            deleteDirectory(dest);
            throw new SnapshotException("Failed to reset snapshot to " + commit + ": " + reset.diagnostic());
        }

        log.debug("Created snapshot {} at {}", id, commit);
        return new Snapshot(id, dest, commit);
    }

    @Override
    public void delete(Snapshot snapshot) {
        if (keep) {
            log.info("Keeping snapshot {} at {}", snapshot.id(), snapshot.path());
            return;
        }
        deleteDirectory(snapshot.path());
        log.debug("Deleted snapshot {}", snapshot.id());
    }

    static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not walk {} for deletion: {}", dir, e.getMessage());
        }
    }
}
