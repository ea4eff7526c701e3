package com.air.worktree;

import java.nio.file.Path;

/**
 * A copy-on-write clone of a work tree, reset to one commit.
 *
 * @param id     unique name, also the directory name
 * @param path   location of the clone
 * @param commit commit HEAD was reset to
 */
public record Snapshot(String id, Path path, String commit) {}
