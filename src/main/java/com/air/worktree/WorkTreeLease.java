package com.air.worktree;

import com.air.core.model.ReviewRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of a {@link WorkTree} by one review. Closing releases the
 * tree; every other operation fails once the lease is closed.
 */
public final class WorkTreeLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkTreeLease.class);

    private final WorkTree tree;
    private final String owner;
    private final String reviewId;
    private final AtomicBoolean closed = new AtomicBoolean();

    WorkTreeLease(WorkTree tree, String owner, String reviewId) {
        this.tree = tree;
        this.owner = owner;
        this.reviewId = reviewId;
        log.debug("{} bound to review {} for {}", tree.name(), reviewId, owner);
    }

    public WorkTree tree() {
        return tree;
    }

    public String owner() {
        return owner;
    }

    public String reviewId() {
        return reviewId;
    }

    public Preparation fetchAndPrepare(ReviewRequest request) throws PreparationException {
        ensureOpen();
        return tree.preparer().prepare(tree.path(), request);
    }

    public void index(String range) throws PreparationException {
        ensureOpen();
        tree.preparer().index(tree.path(), range);
    }

    public Snapshot snapshot(int patchIndex, String commit) throws SnapshotException {
        ensureOpen();
        return tree.snapshotter().create(tree.path(), reviewId, patchIndex, commit);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            tree.release(reviewId);
            log.debug("{} released by review {}", tree.name(), reviewId);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Lease on " + tree.name() + " for review " + reviewId + " is closed");
        }
    }
}
