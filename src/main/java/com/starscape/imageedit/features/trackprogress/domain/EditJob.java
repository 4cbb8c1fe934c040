package com.starscape.imageedit.features.trackprogress.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory aggregate for one edit job.
 *
 * All mutators take the job's own lock. Only the single caller whose update
 * brought done up to expected is told the job completed, so completion is
 * observed exactly once.
 */
public class EditJob {

    private static final int UNSET = -1;

    private final String jobId;
    private final JobKind kind;
    private final String source;
    private final Instant createdAt;
    private final Consumer<JobCompletion> hook;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> seenParts = new HashSet<>();
    private final List<PartOutcome> outcomes = new ArrayList<>();
    private int expected = UNSET;
    private int done;
    private Instant completedAt;

    public EditJob(String jobId, JobKind kind, String source, Consumer<JobCompletion> hook) {
        this.jobId = jobId;
        this.kind = kind;
        this.source = source;
        this.hook = hook;
        this.createdAt = Instant.now();
    }

    public String getJobId() {
        return jobId;
    }

    public Consumer<JobCompletion> getHook() {
        return hook;
    }

    /**
     * Sets the expected part count. Allowed once; zero completes the job.
     */
    public boolean fixExpected(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Expected count must not be negative: " + count);
        }
        lock.lock();
        try {
            if (expected != UNSET) {
                throw new IllegalStateException("Expected count already fixed for job " + jobId);
            }
            expected = count;
            return completeIfDone();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts a part once per key. A repeated key, or any part arriving after
     * completion, leaves the job unchanged.
     */
    public PartMark markPartDone(String partKey, PartOutcome outcome) {
        lock.lock();
        try {
            if (completedAt != null || !seenParts.add(partKey)) {
                return PartMark.IGNORED;
            }
            outcomes.add(outcome);
            done++;
            return completeIfDone() ? PartMark.COMPLETED_JOB : PartMark.COUNTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes back one expected part whose dispatch failed and records why.
     */
    public boolean reduceExpected(PartOutcome failure) {
        lock.lock();
        try {
            if (expected == UNSET) {
                throw new IllegalStateException("Expected count not fixed for job " + jobId);
            }
            if (completedAt != null) {
                throw new IllegalStateException("Job " + jobId + " has no outstanding parts");
            }
            expected--;
            outcomes.add(failure);
            return completeIfDone();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes a job that never got as far as fixing its expected count,
     * recording the reason as its only part.
     */
    public boolean failBeforeDispatch(PartOutcome failure) {
        lock.lock();
        try {
            if (expected != UNSET) {
                throw new IllegalStateException("Job " + jobId + " already dispatching");
            }
            expected = 0;
            outcomes.add(failure);
            return completeIfDone();
        } finally {
            lock.unlock();
        }
    }

    public JobCompletion toCompletion() {
        lock.lock();
        try {
            if (completedAt == null) {
                throw new IllegalStateException("Job " + jobId + " is not complete");
            }
            return new JobCompletion(jobId, kind, source, status(), expected,
                succeededCount(), failedCount(), outcomes, createdAt, completedAt);
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        lock.lock();
        try {
            return new JobSnapshot(jobId, kind, source, status(),
                expected == UNSET ? null : expected, done,
                succeededCount(), failedCount(), List.copyOf(outcomes), createdAt, completedAt);
        } finally {
            lock.unlock();
        }
    }

    private boolean completeIfDone() {
        if (completedAt == null && expected != UNSET && done == expected) {
            completedAt = Instant.now();
            return true;
        }
        return false;
    }

    private JobStatus status() {
        if (completedAt == null) {
            return expected == UNSET && outcomes.isEmpty() ? JobStatus.QUEUED : JobStatus.IN_PROGRESS;
        }
        int failed = failedCount();
        if (failed == 0) {
            return JobStatus.COMPLETED;
        } else if (succeededCount() > 0) {
            return JobStatus.COMPLETED_WITH_ERRORS;
        } else {
            return JobStatus.FAILED;
        }
    }

    private int succeededCount() {
        return (int) outcomes.stream().filter(o -> o.status().isSuccess()).count();
    }

    private int failedCount() {
        return outcomes.size() - succeededCount();
    }
}
