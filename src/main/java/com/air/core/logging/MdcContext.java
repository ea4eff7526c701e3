package com.air.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AIR-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorker(String worker) {
        MDC.put("worker", worker);
    }

    public static void setReview(String reviewId) {
        MDC.put("reviewId", reviewId);
        MDC.remove("patch");
    }

    public static void setPatch(String reviewId, int patchIndex) {
        MDC.put("reviewId", reviewId);
        MDC.put("patch", String.valueOf(patchIndex));
    }

    /** Clears the per-review keys; the worker name stays for the life of the thread. */
    public static void clearReview() {
        MDC.remove("reviewId");
        MDC.remove("patch");
    }

    public static void clear() {
        MDC.remove("reviewId");
        MDC.remove("patch");
        MDC.remove("worker");
    }
}
