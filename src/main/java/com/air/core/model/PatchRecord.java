package com.air.core.model;

import java.time.Instant;

/**
 * Result record of one patch within a review.
 *
 * @param index    1-based position within the review
 * @param commit   resolved commit id
 * @param state    result state
 * @param result   path of the review document, relative to the review directory
 * @param error    terminal error message when {@code state} is {@link PatchState#ERROR}
 * @param snapshot identity of the snapshot that carried this patch to a reviewer
 * @param attempts reviewer attempts made so far
 * @param started  when a reviewer first picked the patch up
 * @param finished when the patch reached a terminal state
 */
public record PatchRecord(
        int index,
        String commit,
        PatchState state,
        String result,
        String error,
        String snapshot,
        int attempts,
        Instant started,
        Instant finished
) {

    public static PatchRecord pending(int index, String commit) {
        return new PatchRecord(index, commit, PatchState.PENDING, null, null, null, 0, null, null);
    }

    public static PatchRecord skipped(int index, String commit) {
        return new PatchRecord(index, commit, PatchState.SKIPPED, null, null, null, 0, null, Instant.now());
    }

    public PatchRecord claimed(String snapshotId, Instant when) {
        return new PatchRecord(index, commit, state, result, error, snapshotId, attempts,
                started != null ? started : when, finished);
    }

    public PatchRecord done(String resultPath, int attemptCount, Instant when) {
        return new PatchRecord(index, commit, PatchState.DONE, resultPath, null, snapshot, attemptCount,
                started, when);
    }

    public PatchRecord failed(String message, int attemptCount, Instant when) {
        return new PatchRecord(index, commit, PatchState.ERROR, null, message, snapshot, attemptCount,
                started, when);
    }
}
