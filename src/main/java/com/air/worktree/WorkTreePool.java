package com.air.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The fixed set of work trees {@code wt-1..N}, one per setup worker.
 *
 * <p>Each tree is a {@code git clone --shared} of the base repository:
 * objects are borrowed from the base, but index, HEAD and remotes are the
 * tree's own, so a copy of the directory is a complete repository. Trees
 * are cloned without a checkout; preparation checks out each review's tip
 * and later reviews only update the files that changed.
 */
public class WorkTreePool {

    private static final Logger log = LoggerFactory.getLogger(WorkTreePool.class);

    private final Path baseRepository;
    private final Path worktreeDir;
    private final int size;
    private final GitRunner git;
    private final TreePreparer preparer;
    private final Snapshotter snapshotter;
    private final List<WorkTree> trees = new ArrayList<>();

    public WorkTreePool(Path baseRepository, Path worktreeDir, int size, GitRunner git,
                        TreePreparer preparer, Snapshotter snapshotter) {
        if (size < 1) {
            throw new IllegalArgumentException("work tree pool size must be positive: " + size);
        }
        this.baseRepository = baseRepository;
        this.worktreeDir = worktreeDir;
        this.size = size;
        this.git = git;
        this.preparer = preparer;
        this.snapshotter = snapshotter;
    }

    /**
     * Creates missing trees and adopts existing ones. Idempotent.
     *
     * @throws IllegalStateException if a tree cannot be created
     */
    public synchronized void initialize() {
        if (!trees.isEmpty()) {
            return;
        }
        try {
            Files.createDirectories(worktreeDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create work tree directory " + worktreeDir, e);
        }
        for (int i = 1; i <= size; i++) {
            Path path = worktreeDir.resolve("wt-" + i);
            if (Files.isDirectory(path.resolve(".git"))) {
                log.info("Reusing work tree {}", path);
            } else {
                log.info("Creating work tree {} from {}", path, baseRepository);
                var result = git.git(worktreeDir, "clone", "--shared", "--no-checkout",
                        baseRepository.toAbsolutePath().toString(), path.toString());
                if (!result.succeeded()) {
                    throw new IllegalStateException("Failed to create work tree " + path + ": " + result.diagnostic());
                }
            }
            trees.add(new WorkTree(i, path, preparer, snapshotter));
        }
    }

    /** Tree {@code id}, 1-based. */
    public synchronized WorkTree tree(int id) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Work tree pool is not initialized");
        }
        return trees.get(id - 1);
    }

    public synchronized List<WorkTree> trees() {
        return List.copyOf(trees);
    }

    public int size() {
        return size;
    }

    public synchronized int boundCount() {
        return (int) trees.stream().filter(WorkTree::isBound).count();
    }

    public Path worktreeDir() {
        return worktreeDir;
    }

    public Snapshotter snapshotter() {
        return snapshotter;
    }
}
