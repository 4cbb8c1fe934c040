package com.starscape.imageedit.features.trackprogress.api.dto;

import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;

import java.time.Instant;
import java.util.List;

public record JobStatusResponse(
    String jobId,
    String kind,
    String source,
    String status,
    Integer expected,
    int doneCount,
    int succeededCount,
    int failedCount,
    List<PartResponse> parts,
    Instant createdAt,
    Instant completedAt
) {
    public record PartResponse(
        String partId,
        String taskId,
        String status,
        String output,
        String error
    ) {
        static PartResponse of(PartOutcome outcome) {
            return new PartResponse(
                outcome.partId(),
                outcome.taskId(),
                outcome.status().name(),
                outcome.output(),
                outcome.error()
            );
        }
    }

    public static JobStatusResponse of(JobSnapshot job) {
        return new JobStatusResponse(
            job.jobId(),
            job.kind().name(),
            job.source(),
            job.status().name(),
            job.expected(),
            job.doneCount(),
            job.succeededCount(),
            job.failedCount(),
            job.parts().stream().map(PartResponse::of).toList(),
            job.createdAt(),
            job.completedAt()
        );
    }
}
