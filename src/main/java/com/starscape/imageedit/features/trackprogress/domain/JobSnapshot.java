package com.starscape.imageedit.features.trackprogress.domain;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a job for status queries.
 *
 * @param expected null while the job is still queued for dispatch
 */
public record JobSnapshot(
    String jobId,
    JobKind kind,
    String source,
    JobStatus status,
    Integer expected,
    int doneCount,
    int succeededCount,
    int failedCount,
    List<PartOutcome> parts,
    Instant createdAt,
    Instant completedAt
) {
    public static JobSnapshot of(JobCompletion completion) {
        return new JobSnapshot(
            completion.jobId(),
            completion.kind(),
            completion.source(),
            completion.status(),
            completion.expected(),
            completion.expected(),
            completion.succeededCount(),
            completion.failedCount(),
            completion.parts(),
            completion.createdAt(),
            completion.completedAt()
        );
    }
}
