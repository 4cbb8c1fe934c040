package com.starscape.imageedit.features.extractpatches.domain;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * One entry of the "differences" list: a polygon plus the edit prompt for it.
 */
public record Region(
    List<RegionPoint> points,
    @JsonAlias("prompt")
    String text
) {
    public static final int MIN_POINTS = 4;

    public Region {
        points = points == null ? List.of() : List.copyOf(points);
        text = text == null ? "" : text;
    }

    public boolean hasEnoughPoints() {
        return points.size() >= MIN_POINTS;
    }
}
