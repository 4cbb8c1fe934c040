package com.starscape.imageedit.features.trackprogress.domain;

import java.time.Instant;

/**
 * @param partId   "0" for whole-image jobs, the region index for batch patches
 * @param taskId   remote task id, null when the task was never created
 * @param output   where the result was stored, null unless SUCCEEDED
 * @param error    failure description, null when SUCCEEDED
 */
public record PartOutcome(
    String partId,
    String taskId,
    PartStatus status,
    String output,
    String error,
    Instant recordedAt
) {
    public static PartOutcome succeeded(String partId, String taskId, String output) {
        return new PartOutcome(partId, taskId, PartStatus.SUCCEEDED, output, null, Instant.now());
    }

    public static PartOutcome failed(String partId, String taskId, PartStatus status, String error) {
        if (status.isSuccess()) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return new PartOutcome(partId, taskId, status, null, error, Instant.now());
    }
}
