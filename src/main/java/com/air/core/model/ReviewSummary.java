package com.air.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Process-wide counts of reviews per status.
 */
public record ReviewSummary(Map<ReviewStatus, Long> counts) {

    public ReviewSummary {
        var copy = new EnumMap<ReviewStatus, Long>(ReviewStatus.class);
        for (var status : ReviewStatus.values()) {
            copy.put(status, 0L);
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Map.copyOf(copy);
    }

    public long count(ReviewStatus status) {
        return counts.getOrDefault(status, 0L);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
