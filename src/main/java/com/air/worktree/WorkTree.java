package com.air.worktree;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One git working directory of the fixed pool. Idle, or bound to exactly
 * one review through a {@link WorkTreeLease}.
 */
public class WorkTree {

    private final int id;
    private final Path path;
    private final TreePreparer preparer;
    private final Snapshotter snapshotter;

    // guarded by this
    private String boundReview;

    public WorkTree(int id, Path path, TreePreparer preparer, Snapshotter snapshotter) {
        this.id = id;
        this.path = path;
        this.preparer = preparer;
        this.snapshotter = snapshotter;
    }

    public int id() {
        return id;
    }

    public String name() {
        return "wt-" + id;
    }

    public Path path() {
        return path;
    }

    /**
     * Binds the tree to a review.
     *
     * @throws IllegalStateException if the tree is already bound
     */
    public synchronized WorkTreeLease bind(String owner, String reviewId) {
        if (boundReview != null) {
            throw new IllegalStateException(name() + " is already bound to review " + boundReview);
        }
        boundReview = reviewId;
        return new WorkTreeLease(this, owner, reviewId);
    }

    public synchronized boolean isBound() {
        return boundReview != null;
    }

    public synchronized Optional<String> boundReview() {
        return Optional.ofNullable(boundReview);
    }

    synchronized void release(String reviewId) {
        if (!reviewId.equals(boundReview)) {
            throw new IllegalStateException(name() + " is not bound to review " + reviewId);
        }
        boundReview = null;
    }

    public TreePreparer preparer() {
        return preparer;
    }

    public Snapshotter snapshotter() {
        return snapshotter;
    }
}
