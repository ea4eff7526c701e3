package com.air.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable record of a review request: its status, timestamps, and per-patch
 * results. Instances are immutable; the store replaces the whole record on
 * every update.
 */
public record ReviewRecord(
        String id,
        String owner,
        String tree,
        String branch,
        String origin,
        ReviewStatus status,
        String message,
        Instant submitted,
        Instant setupStarted,
        Instant setupCompleted,
        Instant reviewStarted,
        Instant completed,
        List<PatchRecord> patches
) {

    public ReviewRecord {
        patches = patches == null ? List.of() : List.copyOf(patches);
    }

    public static ReviewRecord queued(ReviewRequest request) {
        return new ReviewRecord(request.id(), request.owner(), request.tree(), request.branch(),
                request.origin().describe(), ReviewStatus.QUEUED, null, request.submitted(),
                null, null, null, null, List.of());
    }

    public ReviewRecord withStatus(ReviewStatus newStatus) {
        return new ReviewRecord(id, owner, tree, branch, origin, newStatus, message, submitted,
                setupStarted, setupCompleted, reviewStarted, completed, patches);
    }

    public ReviewRecord withMessage(String newMessage) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, newMessage, submitted,
                setupStarted, setupCompleted, reviewStarted, completed, patches);
    }

    public ReviewRecord withSetupStarted(Instant when) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, message, submitted,
                setupStarted != null ? setupStarted : when, setupCompleted, reviewStarted, completed, patches);
    }

    public ReviewRecord withSetupCompleted(Instant when) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, message, submitted,
                setupStarted, when, reviewStarted, completed, patches);
    }

    public ReviewRecord withReviewStarted(Instant when) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, message, submitted,
                setupStarted, setupCompleted, reviewStarted != null ? reviewStarted : when, completed, patches);
    }

    public ReviewRecord withCompleted(Instant when) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, message, submitted,
                setupStarted, setupCompleted, reviewStarted, completed != null ? completed : when, patches);
    }

    public ReviewRecord withPatches(List<PatchRecord> newPatches) {
        return new ReviewRecord(id, owner, tree, branch, origin, status, message, submitted,
                setupStarted, setupCompleted, reviewStarted, completed, newPatches);
    }

    /** Returns a copy with the patch at {@code index} replaced. */
    public ReviewRecord withPatch(PatchRecord patch) {
        var updated = new ArrayList<>(patches);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).index() == patch.index()) {
                updated.set(i, patch);
                return withPatches(updated);
            }
        }
        throw new IllegalArgumentException("Review " + id + " has no patch " + patch.index());
    }

    public PatchRecord patch(int index) {
        for (var p : patches) {
            if (p.index() == index) {
                return p;
            }
        }
        return null;
    }

    @JsonIgnore
    public int patchCount() {
        return patches.size();
    }

    @JsonIgnore
    public boolean hasPendingPatches() {
        return patches.stream().anyMatch(p -> p.state() == PatchState.PENDING);
    }

    @JsonIgnore
    public long countPatches(PatchState state) {
        return patches.stream().filter(p -> p.state() == state).count();
    }
}
