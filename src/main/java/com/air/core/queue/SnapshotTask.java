package com.air.core.queue;

import com.air.worktree.Snapshot;

/**
 * Unit of work handed from a setup worker to a reviewer worker.
 *
 * @param reviewId   owning review
 * @param patchIndex 1-based patch index within the review
 * @param commit     commit the snapshot is fixed at
 * @param snapshot   the copy-on-write clone to review; deleted by whichever reviewer pops this task
 */
public record SnapshotTask(String reviewId, int patchIndex, String commit, Snapshot snapshot) {}
