package com.starscape.imageedit.features.trackprogress.domain;

/**
 * How a part of a job ended. Every status except DISPATCH_FAILED counts toward
 * the job's done count; dispatch failures lower the expected count instead.
 */
public enum PartStatus {
    SUCCEEDED,
    REMOTE_FAILED,
    NO_RESULT,
    DOWNLOAD_FAILED,
    STORE_FAILED,
    EXPIRED,
    REJECTED,
    DISPATCH_FAILED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
