package com.starscape.imageedit.features.trackprogress.app;

import com.starscape.imageedit.common.config.OrchestratorProperties;
import com.starscape.imageedit.features.trackprogress.domain.EditJob;
import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;
import com.starscape.imageedit.features.trackprogress.domain.JobKind;
import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.PartMark;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Tracks active edit jobs and decides when each one is complete.
 *
 * The registry lock guards only the active and completed maps; counting happens
 * under the job's own lock, and hooks run after both are released.
 */
@Service
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Object lock = new Object();
    private final Map<String, EditJob> active = new HashMap<>();
    private final Map<String, JobCompletion> completed;
    private final List<JobCompletionListener> listeners;

    @Autowired
    public JobRegistry(List<JobCompletionListener> listeners, OrchestratorProperties properties) {
        this(listeners, properties.getCompletedJobHistory());
    }

    public JobRegistry(List<JobCompletionListener> listeners, int completedHistory) {
        this.listeners = List.copyOf(listeners);
        this.completed = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JobCompletion> eldest) {
                return size() > completedHistory;
            }
        };
    }

    public static String newJobId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "");
    }

    public String startJob(int expected) {
        return startJob(JobKind.BATCH, null, expected, null);
    }

    public String startJob(JobKind kind, String source, int expected, Consumer<JobCompletion> hook) {
        String jobId = newJobId();
        openJob(jobId, kind, source, hook);
        fixExpected(jobId, expected);
        return jobId;
    }

    /**
     * Registers a job whose expected count is not known yet.
     */
    public void openJob(String jobId, JobKind kind, String source, Consumer<JobCompletion> hook) {
        EditJob job = new EditJob(jobId, kind, source, hook);
        synchronized (lock) {
            if (active.containsKey(jobId) || completed.containsKey(jobId)) {
                throw new IllegalStateException("Job already exists: " + jobId);
            }
            active.put(jobId, job);
        }
        log.debug("Opened job: jobId={}, kind={}, source={}", jobId, kind, source);
    }

    public boolean fixExpected(String jobId, int expected) {
        EditJob job = requireActive(jobId);
        log.info("Job expects {} part(s): jobId={}", expected, jobId);
        return finishIf(job.fixExpected(expected), job);
    }

    /**
     * @return true when this call completed the job
     */
    public boolean markPartDone(String jobId, String partKey, PartOutcome outcome) {
        EditJob job;
        synchronized (lock) {
            job = active.get(jobId);
        }
        if (job == null) {
            log.warn("Part for inactive job ignored: jobId={}, partKey={}, status={}", jobId, partKey, outcome.status());
            return false;
        }
        PartMark mark = job.markPartDone(partKey, outcome);
        if (mark == PartMark.IGNORED) {
            log.debug("Duplicate part ignored: jobId={}, partKey={}", jobId, partKey);
            return false;
        }
        notifyPart(outcome, job.snapshot());
        return finishIf(mark == PartMark.COMPLETED_JOB, job);
    }

    /**
     * Removes one part whose dispatch failed from the expected count.
     *
     * @return true when this call completed the job
     */
    public boolean reduceExpected(String jobId, PartOutcome failure) {
        EditJob job = requireActive(jobId);
        boolean completedNow = job.reduceExpected(failure);
        notifyPart(failure, job.snapshot());
        return finishIf(completedNow, job);
    }

    /**
     * Completes a job whose parts could not even be determined.
     */
    public boolean failBeforeDispatch(String jobId, PartOutcome failure) {
        EditJob job = requireActive(jobId);
        return finishIf(job.failBeforeDispatch(failure), job);
    }

    public Optional<JobSnapshot> find(String jobId) {
        EditJob job;
        synchronized (lock) {
            job = active.get(jobId);
            if (job == null) {
                return Optional.ofNullable(completed.get(jobId)).map(JobSnapshot::of);
            }
        }
        return Optional.of(job.snapshot());
    }

    public int activeCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    private EditJob requireActive(String jobId) {
        synchronized (lock) {
            EditJob job = active.get(jobId);
            if (job == null) {
                throw new IllegalStateException("No active job: " + jobId);
            }
            return job;
        }
    }

    private boolean finishIf(boolean completedNow, EditJob job) {
        if (!completedNow) {
            return false;
        }
        JobCompletion completion = job.toCompletion();
        synchronized (lock) {
            active.remove(job.getJobId());
            completed.put(job.getJobId(), completion);
        }
        log.info("Job completed: jobId={}, status={}, succeeded={}, failed={}, expected={}",
            completion.jobId(), completion.status(), completion.succeededCount(),
            completion.failedCount(), completion.expected());
        fireHooks(job.getHook(), completion);
        return true;
    }

    private void fireHooks(Consumer<JobCompletion> hook, JobCompletion completion) {
        if (hook != null) {
            try {
                hook.accept(completion);
            } catch (RuntimeException e) {
                log.error("Completion hook failed: jobId={}", completion.jobId(), e);
            }
        }
        for (JobCompletionListener listener : listeners) {
            try {
                listener.onJobCompleted(completion);
            } catch (RuntimeException e) {
                log.error("Completion listener {} failed: jobId={}",
                    listener.getClass().getSimpleName(), completion.jobId(), e);
            }
        }
    }

    private void notifyPart(PartOutcome outcome, JobSnapshot snapshot) {
        for (JobCompletionListener listener : listeners) {
            try {
                listener.onPartRecorded(outcome, snapshot);
            } catch (RuntimeException e) {
                log.error("Part listener {} failed: jobId={}, partId={}",
                    listener.getClass().getSimpleName(), snapshot.jobId(), outcome.partId(), e);
            }
        }
    }
}
