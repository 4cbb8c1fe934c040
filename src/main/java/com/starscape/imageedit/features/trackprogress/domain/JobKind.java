package com.starscape.imageedit.features.trackprogress.domain;

public enum JobKind {
    IMAGE,
    BATCH
}
