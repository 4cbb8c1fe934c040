package com.starscape.imageedit.features.extractpatches.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the normalized region coordinates put y = 0.
 * Only the vertical axis differs between the two modes.
 */
public enum CoordinateOrigin {
    TOP_LEFT("top-left"),
    BOTTOM_LEFT("bottom-left");

    private final String label;

    CoordinateOrigin(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Maps a normalized y in [0, 1] onto pixel rows [0, height - 1].
     */
    public double toPixelY(double normalizedY, int height) {
        double y = this == BOTTOM_LEFT ? 1.0 - normalizedY : normalizedY;
        return y * (height - 1);
    }

    @JsonCreator
    public static CoordinateOrigin fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (CoordinateOrigin origin : values()) {
            if (origin.label.equalsIgnoreCase(value.trim()) || origin.name().equalsIgnoreCase(value.trim())) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown coordinate origin: " + value);
    }
}
