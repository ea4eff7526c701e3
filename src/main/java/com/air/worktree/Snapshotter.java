package com.air.worktree;

import java.nio.file.Path;

/**
 * Cuts and disposes of per-patch snapshots of a work tree.
 */
public interface Snapshotter {

    /**
     * Verifies the snapshot mechanism works where snapshots will be created.
     *
     * @throws IllegalStateException if it does not
     */
    void probe();

    Snapshot create(Path tree, String reviewId, int patchIndex, String commit) throws SnapshotException;

    void delete(Snapshot snapshot);
}
