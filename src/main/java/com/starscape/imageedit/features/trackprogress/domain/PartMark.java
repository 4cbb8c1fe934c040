package com.starscape.imageedit.features.trackprogress.domain;

/**
 * Result of offering a part to a job.
 */
public enum PartMark {
    IGNORED,
    COUNTED,
    COMPLETED_JOB
}
