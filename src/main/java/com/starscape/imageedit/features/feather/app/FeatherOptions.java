package com.starscape.imageedit.features.feather.app;

/**
 * @param radius width in pixels of the transparent-to-opaque ramp; 0 keeps a hard edge
 * @param shrink erosion radius applied to the opaque interior before the ramp is computed
 * @param gamma  exponent applied to the ramp; below 1 softens, above 1 hardens, 1 is linear
 */
public record FeatherOptions(int radius, int shrink, double gamma) {

    public FeatherOptions {
        if (radius < 0) {
            throw new IllegalArgumentException("Feather radius must not be negative: " + radius);
        }
        if (shrink < 0) {
            throw new IllegalArgumentException("Shrink radius must not be negative: " + shrink);
        }
    }

    public static FeatherOptions ofRadius(int radius) {
        return new FeatherOptions(radius, 0, 1.0);
    }

    boolean appliesGamma() {
        return gamma > 0 && gamma != 1.0;
    }
}
