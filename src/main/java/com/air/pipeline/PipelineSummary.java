package com.air.pipeline;

import com.air.core.model.ReviewSummary;

public record PipelineSummary(
        ReviewSummary reviews,
        int queueLength,
        int handoffDepth,
        int handoffCapacity,
        int setupConcurrency,
        int reviewerConcurrency
) {}
