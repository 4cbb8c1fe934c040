package com.starscape.imageedit.features.submitjob.domain;

public enum ReleaseResult {
    RELEASED,
    ALREADY_RELEASED
}
