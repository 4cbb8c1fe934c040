package com.starscape.imageedit.features.trackprogress.api.dto;

import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;

import java.time.Instant;

/**
 * Progress update DTO for WebSocket broadcasts.
 * Sent when one part of a job is counted or its dispatch fails.
 */
public record PartProgressUpdate(
    String jobId,
    String partId,
    String taskId,
    String status,
    String output,
    String message,
    int doneCount,
    Integer expected,
    Instant timestamp
) {
    public static PartProgressUpdate of(PartOutcome outcome, JobSnapshot job) {
        return new PartProgressUpdate(
            job.jobId(),
            outcome.partId(),
            outcome.taskId(),
            outcome.status().name(),
            outcome.output(),
            outcome.error(),
            job.doneCount(),
            job.expected(),
            Instant.now()
        );
    }
}
