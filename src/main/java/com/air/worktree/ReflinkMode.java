package com.air.worktree;

/**
 * How snapshots use copy-on-write ({@code cp --reflink=...}).
 */
public enum ReflinkMode {
    /** Require copy-on-write; checked once at start. */
    ALWAYS("always"),
    /** Use copy-on-write when the filesystem supports it, fall back to a full copy. */
    AUTO("auto");

    private final String flag;

    ReflinkMode(String flag) {
        this.flag = flag;
    }

    public String cpFlag() {
        return "--reflink=" + flag;
    }
}
