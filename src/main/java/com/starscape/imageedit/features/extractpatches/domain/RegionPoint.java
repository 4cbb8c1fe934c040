package com.starscape.imageedit.features.extractpatches.domain;

/**
 * A region vertex in normalized image coordinates, both axes in [0, 1].
 */
public record RegionPoint(double x, double y) {}
