package com.starscape.imageedit.features.callback.app;

import com.starscape.imageedit.features.submitjob.domain.AdmissionGate;
import com.starscape.imageedit.features.submitjob.domain.TaskMeta;
import com.starscape.imageedit.features.submitjob.domain.TaskRegistry;
import com.starscape.imageedit.features.trackprogress.app.JobRegistry;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import com.starscape.imageedit.features.trackprogress.domain.PartStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Gives up on remote tasks that never called back, so their grants return to
 * the gate and their jobs can still complete.
 */
@Component
public class TaskExpiryReaper {

    private static final Logger log = LoggerFactory.getLogger(TaskExpiryReaper.class);

    private final TaskRegistry taskRegistry;
    private final AdmissionGate admissionGate;
    private final JobRegistry jobRegistry;

    public TaskExpiryReaper(TaskRegistry taskRegistry, AdmissionGate admissionGate, JobRegistry jobRegistry) {
        this.taskRegistry = taskRegistry;
        this.admissionGate = admissionGate;
        this.jobRegistry = jobRegistry;
    }

    @Scheduled(fixedDelayString = "${app.orchestrator.expiry-sweep-interval:PT30S}")
    public void sweepExpiredTasks() {
        sweep(Instant.now());
    }

    /**
     * @return number of tasks expired by this sweep
     */
    public int sweep(Instant now) {
        List<TaskMeta> expired = taskRegistry.removeExpired(now);
        for (TaskMeta meta : expired) {
            admissionGate.release(meta.taskId());
            log.warn("Task expired without callback: jobId={}, partId={}, taskId={}, dispatchedAt={}",
                meta.jobId(), meta.partId(), meta.taskId(), meta.dispatchedAt());
            jobRegistry.markPartDone(meta.jobId(), meta.taskId(),
                PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.EXPIRED,
                    "No callback before " + meta.deadline()));
        }
        if (!expired.isEmpty()) {
            log.info("Expiry sweep released {} task(s), inflight={}", expired.size(), admissionGate.inUse());
        }
        return expired.size();
    }
}
