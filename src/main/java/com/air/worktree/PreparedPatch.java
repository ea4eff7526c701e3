package com.air.worktree;

/**
 * One patch resolved by preparation.
 *
 * @param index  1-based position within the review
 * @param commit commit that carries the patch in the work tree
 * @param input  patch text kept as the patch's input artifact
 */
public record PreparedPatch(int index, String commit, String input) {}
