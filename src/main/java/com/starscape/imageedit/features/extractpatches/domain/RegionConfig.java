package com.starscape.imageedit.features.extractpatches.domain;

import java.util.List;

/**
 * Region config file: {@code { "differences": [ { "points": [...], "text": "..." } ] }}.
 */
public record RegionConfig(List<Region> differences) {

    public RegionConfig {
        differences = differences == null ? List.of() : List.copyOf(differences);
    }
}
