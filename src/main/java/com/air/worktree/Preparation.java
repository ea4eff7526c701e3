package com.air.worktree;

import java.util.List;

/**
 * Result of preparing a work tree: ordered patch commits and the git range covering them.
 */
public record Preparation(List<PreparedPatch> patches, String range) {

    public Preparation {
        patches = List.copyOf(patches);
    }

    public int patchCount() {
        return patches.size();
    }
}
