package com.air.reviewer;

import java.nio.file.Path;

/**
 * One patch to review.
 *
 * @param reviewId   owning review
 * @param patchIndex 1-based patch index
 * @param commit     commit under review, checked out as HEAD of {@code workDir}
 * @param workDir    snapshot the reviewer runs in
 * @param outputDir  per-patch results directory
 */
public record ReviewJob(String reviewId, int patchIndex, String commit, Path workDir, Path outputDir) {}
