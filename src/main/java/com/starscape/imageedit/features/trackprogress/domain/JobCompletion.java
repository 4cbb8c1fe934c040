package com.starscape.imageedit.features.trackprogress.domain;

import java.time.Instant;
import java.util.List;

/**
 * Final state of a job, handed to completion hooks exactly once.
 * {@code parts} holds every counted part plus the parts whose dispatch failed,
 * so {@code parts.size()} may exceed {@code expected}.
 */
public record JobCompletion(
    String jobId,
    JobKind kind,
    String source,
    JobStatus status,
    int expected,
    int succeededCount,
    int failedCount,
    List<PartOutcome> parts,
    Instant createdAt,
    Instant completedAt
) {
    public JobCompletion {
        parts = List.copyOf(parts);
    }
}
