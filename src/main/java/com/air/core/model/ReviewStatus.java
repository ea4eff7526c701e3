package com.air.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a review request.
 */
public enum ReviewStatus {
    QUEUED("queued"),
    SETUP_IN_PROGRESS("setup-in-progress"),
    REVIEWING("reviewing"),
    DONE("done"),
    ERROR("error");

    private final String label;

    ReviewStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonCreator
    public static ReviewStatus fromLabel(String label) {
        for (var status : values()) {
            if (status.label.equals(label) || status.name().equals(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown review status: " + label);
    }
}
