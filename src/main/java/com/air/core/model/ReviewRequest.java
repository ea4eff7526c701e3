package com.air.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One submitted unit of review work.
 *
 * @param id        opaque unique identity
 * @param owner     principal that submitted the request
 * @param tree      name of the source tree (git remote) the patches apply to
 * @param branch    branch of that tree; {@code null} means the remote's default branch
 * @param origin    where the patches come from
 * @param mask      optional per-patch flags, {@code false} skips the patch; {@code null} reviews everything
 * @param submitted submission time
 */
public record ReviewRequest(
        String id,
        String owner,
        String tree,
        String branch,
        Origin origin,
        List<Boolean> mask,
        Instant submitted
) {

    public ReviewRequest {
        if (id == null || id.isBlank()) {
            throw new ValidationException("id is required");
        }
        if (owner == null || owner.isBlank()) {
            throw new ValidationException("owner is required");
        }
        if (tree == null || tree.isBlank()) {
            throw new ValidationException("tree is required");
        }
        if (origin == null) {
            throw new ValidationException("Exactly one of series id, patches, or hash must be provided");
        }
        if (branch != null && branch.isBlank()) {
            branch = null;
        }
        if (mask != null) {
            if (mask.isEmpty()) {
                mask = null;
            } else {
                if (mask.contains(null)) {
                    throw new ValidationException("mask entries must be true or false");
                }
                int expected = origin.knownPatchCount();
                if (expected >= 0 && mask.size() != expected) {
                    throw new ValidationException(
                            "mask has %d entries but the request has %d patches".formatted(mask.size(), expected));
                }
                mask = List.copyOf(mask);
            }
        }
        if (submitted == null) {
            submitted = Instant.now();
        }
    }

    /** Creates a request with a fresh identity, stamped with the current time. */
    public static ReviewRequest create(String owner, String tree, String branch, Origin origin, List<Boolean> mask) {
        return new ReviewRequest(UUID.randomUUID().toString(), owner, tree, branch, origin, mask, Instant.now());
    }

    /** Whether the patch at the 1-based {@code index} should be reviewed. */
    public boolean isSelected(int index) {
        if (mask == null || index - 1 >= mask.size()) {
            return true;
        }
        return mask.get(index - 1);
    }

    /** Patch count used to estimate queue position. */
    public int estimatedPatchCount() {
        return origin.estimatedPatchCount();
    }
}
