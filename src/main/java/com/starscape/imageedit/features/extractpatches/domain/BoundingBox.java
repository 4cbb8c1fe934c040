package com.starscape.imageedit.features.extractpatches.domain;

/**
 * Axis-aligned pixel box, min inclusive and max exclusive.
 */
public record BoundingBox(int xMin, int yMin, int xMax, int yMax) {

    public int width() {
        return xMax - xMin;
    }

    public int height() {
        return yMax - yMin;
    }

    public boolean isEmpty() {
        return width() <= 0 || height() <= 0;
    }
}
