package com.starscape.imageedit.features.submitjob.domain;

import java.time.Instant;

/**
 * Everything the callback path needs to finish a remote task.
 *
 * @param output      destination the result is stored at
 * @param partId      "0" for whole-image jobs, the region index for patches
 * @param feather     whether the downloaded result is feathered before storing
 */
public record TaskMeta(
    String taskId,
    String output,
    String jobId,
    String partId,
    boolean feather,
    Instant dispatchedAt,
    Instant deadline
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }
}
