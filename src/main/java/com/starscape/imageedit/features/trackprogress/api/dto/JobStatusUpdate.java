package com.starscape.imageedit.features.trackprogress.api.dto;

import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;

import java.time.Instant;

/**
 * Job status update DTO for WebSocket broadcasts.
 * Sent once when a job completes.
 */
public record JobStatusUpdate(
    String jobId,
    String kind,
    String status,
    int totalCount,
    int completedCount,
    int failedCount,
    Instant timestamp
) {
    public static JobStatusUpdate of(JobCompletion completion) {
        return new JobStatusUpdate(
            completion.jobId(),
            completion.kind().name(),
            completion.status().name(),
            completion.expected(),
            completion.succeededCount(),
            completion.failedCount(),
            completion.completedAt()
        );
    }
}
