package com.air.worktree;

/**
 * A snapshot for one patch could not be cut. Fatal to that patch only.
 */
public class SnapshotException extends Exception {

    public SnapshotException(String message) {
        super(message);
    }
}
