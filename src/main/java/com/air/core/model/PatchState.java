package com.air.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result state of a single patch.
 */
public enum PatchState {
    PENDING("pending"),
    SKIPPED("skipped"),
    DONE("done"),
    ERROR("error");

    private final String label;

    PatchState(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonCreator
    public static PatchState fromLabel(String label) {
        for (var state : values()) {
            if (state.label.equals(label) || state.name().equals(label)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown patch state: " + label);
    }
}
