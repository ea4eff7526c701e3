package com.air.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setWorker puts worker in MDC")
    void setWorker() {
        MdcContext.setWorker("setup-1");
        assertEquals("setup-1", MDC.get("worker"));
    }

    @Test
    @DisplayName("setPatch puts reviewId and patch in MDC")
    void setPatch() {
        MdcContext.setPatch("r-1", 3);
        assertEquals("r-1", MDC.get("reviewId"));
        assertEquals("3", MDC.get("patch"));
    }

    @Test
    @DisplayName("setReview drops a patch left from an earlier task")
    void setReviewDropsPatch() {
        MdcContext.setPatch("r-1", 3);
        MdcContext.setReview("r-2");
        assertEquals("r-2", MDC.get("reviewId"));
        assertNull(MDC.get("patch"));
    }

    @Test
    @DisplayName("clearReview keeps the worker name")
    void clearReviewKeepsWorker() {
        MdcContext.setWorker("reviewer-2");
        MdcContext.setPatch("r-1", 1);
        MdcContext.clearReview();
        assertEquals("reviewer-2", MDC.get("worker"));
        assertNull(MDC.get("reviewId"));
        assertNull(MDC.get("patch"));
    }

    @Test
    @DisplayName("clear removes all air MDC keys")
    void clear() {
        MdcContext.setWorker("setup-1");
        MdcContext.setPatch("r-1", 1);
        MdcContext.clear();
        assertNull(MDC.get("worker"));
        assertNull(MDC.get("reviewId"));
        assertNull(MDC.get("patch"));
    }
}
