package com.starscape.imageedit.features.callback.app;

import com.starscape.imageedit.common.config.ExecutorConfig;
import com.starscape.imageedit.common.config.OrchestratorProperties;
import com.starscape.imageedit.common.image.ImageCodec;
import com.starscape.imageedit.common.storage.ResultStore;
import com.starscape.imageedit.features.callback.domain.CallbackEvent;
import com.starscape.imageedit.features.callback.domain.CallbackOutcome;
import com.starscape.imageedit.features.feather.app.FeatheringEngine;
import com.starscape.imageedit.features.remotetask.domain.RemoteTaskService;
import com.starscape.imageedit.features.submitjob.app.TaskRegistrationListener;
import com.starscape.imageedit.features.submitjob.domain.AdmissionGate;
import com.starscape.imageedit.features.submitjob.domain.ReleaseResult;
import com.starscape.imageedit.features.submitjob.domain.TaskMeta;
import com.starscape.imageedit.features.submitjob.domain.TaskRegistry;
import com.starscape.imageedit.features.trackprogress.app.JobRegistry;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import com.starscape.imageedit.features.trackprogress.domain.PartStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingests remote task completions.
 *
 * The inbound call only looks the task up and frees its admission grant; the
 * download, feathering, storing and counting run on the callback pool. The task
 * entry is consumed there, so a redelivered callback that arrives before or after
 * it finds nothing to do.
 *
 * A callback can beat the registration of its own task, since the remote
 * service may call back before createTask has returned. Callbacks for unknown
 * tasks are therefore held in a small bounded buffer and replayed if the task
 * is registered later.
 */
@Service
public class TaskCallbackHandler implements TaskRegistrationListener {

    private static final Logger log = LoggerFactory.getLogger(TaskCallbackHandler.class);

    private final TaskRegistry taskRegistry;
    private final AdmissionGate admissionGate;
    private final JobRegistry jobRegistry;
    private final RemoteTaskService remoteTaskService;
    private final FeatheringEngine featheringEngine;
    private final ResultStore resultStore;
    private final Executor callbackExecutor;

    private final Object earlyLock = new Object();
    private final Map<String, CallbackEvent> earlyCallbacks;

    @Autowired
    public TaskCallbackHandler(
            TaskRegistry taskRegistry,
            AdmissionGate admissionGate,
            JobRegistry jobRegistry,
            RemoteTaskService remoteTaskService,
            FeatheringEngine featheringEngine,
            ResultStore resultStore,
            @Qualifier(ExecutorConfig.CALLBACK_EXECUTOR) Executor callbackExecutor,
            OrchestratorProperties orchestratorProperties) {
        this(taskRegistry, admissionGate, jobRegistry, remoteTaskService, featheringEngine, resultStore,
            callbackExecutor, orchestratorProperties.getEarlyCallbackCapacity());
    }

    public TaskCallbackHandler(
            TaskRegistry taskRegistry,
            AdmissionGate admissionGate,
            JobRegistry jobRegistry,
            RemoteTaskService remoteTaskService,
            FeatheringEngine featheringEngine,
            ResultStore resultStore,
            Executor callbackExecutor,
            int earlyCallbackCapacity) {
        this.taskRegistry = taskRegistry;
        this.admissionGate = admissionGate;
        this.jobRegistry = jobRegistry;
        this.remoteTaskService = remoteTaskService;
        this.featheringEngine = featheringEngine;
        this.resultStore = resultStore;
        this.callbackExecutor = callbackExecutor;
        this.earlyCallbacks = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CallbackEvent> eldest) {
                if (size() <= earlyCallbackCapacity) {
                    return false;
                }
                log.warn("Early callback dropped, buffer full: taskId={}", eldest.getKey());
                return true;
            }
        };
    }

    public CallbackOutcome onCallback(CallbackEvent event) {
        if (!event.hasTaskId()) {
            log.warn("Callback without task id discarded: {}", event);
            return CallbackOutcome.MISSING_TASK_ID;
        }
        String taskId = event.taskId();
        synchronized (earlyLock) {
            if (taskRegistry.find(taskId).isEmpty()) {
                earlyCallbacks.put(taskId, event);
                log.warn("Callback for unknown task held for replay: taskId={}", taskId);
                return CallbackOutcome.UNKNOWN_TASK;
            }
        }

        ReleaseResult released = admissionGate.release(taskId);
        if (released == ReleaseResult.ALREADY_RELEASED) {
            log.debug("Redelivered callback: taskId={}", taskId);
            return CallbackOutcome.DUPLICATE;
        }

        try {
            callbackExecutor.execute(() -> complete(event));
        } catch (RejectedExecutionException e) {
            log.error("Callback pool rejected completion: taskId={}", taskId, e);
            taskRegistry.remove(taskId).ifPresent(meta -> jobRegistry.markPartDone(meta.jobId(), meta.taskId(),
                PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.REJECTED, "Callback pool saturated")));
            return CallbackOutcome.REJECTED;
        }
        log.info("Callback accepted: taskId={}, event={}, inflight={}",
            taskId, event.getClass().getSimpleName(), admissionGate.inUse());
        return CallbackOutcome.ACCEPTED;
    }

    /**
     * Replays a callback that arrived before its task was registered.
     */
    @Override
    public void onTaskRegistered(TaskMeta meta) {
        CallbackEvent early;
        synchronized (earlyLock) {
            early = earlyCallbacks.remove(meta.taskId());
        }
        if (early != null) {
            log.info("Replaying early callback: jobId={}, partId={}, taskId={}",
                meta.jobId(), meta.partId(), meta.taskId());
            onCallback(early);
        }
    }

    /**
     * Runs on the callback pool.
     */
    void complete(CallbackEvent event) {
        Optional<TaskMeta> removed = taskRegistry.remove(event.taskId());
        if (removed.isEmpty()) {
            log.debug("Task already consumed: taskId={}", event.taskId());
            return;
        }
        TaskMeta meta = removed.get();
        PartOutcome outcome = resolve(event, meta);
        jobRegistry.markPartDone(meta.jobId(), meta.taskId(), outcome);
    }

    private PartOutcome resolve(CallbackEvent event, TaskMeta meta) {
        if (event instanceof CallbackEvent.Failure failure) {
            log.warn("Remote task failed: jobId={}, partId={}, taskId={}, code={}, message={}",
                meta.jobId(), meta.partId(), meta.taskId(), failure.code(), failure.message());
            return PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.REMOTE_FAILED,
                "Remote code " + failure.code() + (failure.message() != null ? ": " + failure.message() : ""));
        }
        if (event instanceof CallbackEvent.Malformed malformed) {
            log.warn("Remote task reported no result: jobId={}, partId={}, taskId={}, reason={}",
                meta.jobId(), meta.partId(), meta.taskId(), malformed.reason());
            return PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.NO_RESULT, malformed.reason());
        }
        return store((CallbackEvent.Success) event, meta);
    }

    private PartOutcome store(CallbackEvent.Success success, TaskMeta meta) {
        byte[] content;
        try {
            content = remoteTaskService.download(success.fileUrl());
        } catch (RuntimeException e) {
            log.error("Result download failed: jobId={}, partId={}, taskId={}, url={}",
                meta.jobId(), meta.partId(), meta.taskId(), success.fileUrl(), e);
            return PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.DOWNLOAD_FAILED, e.getMessage());
        }

        try {
            byte[] result = meta.feather()
                ? featheringEngine.featherPng(content)
                : ImageCodec.encodeFor(meta.output(), content);
            String location = resultStore.save(meta.output(), result);
            log.info("Result stored: jobId={}, partId={}, taskId={}, location={}",
                meta.jobId(), meta.partId(), meta.taskId(), location);
            return PartOutcome.succeeded(meta.partId(), meta.taskId(), location);
        } catch (IOException | RuntimeException e) {
            log.error("Result store failed: jobId={}, partId={}, taskId={}, output={}",
                meta.jobId(), meta.partId(), meta.taskId(), meta.output(), e);
            return PartOutcome.failed(meta.partId(), meta.taskId(), PartStatus.STORE_FAILED, e.getMessage());
        }
    }
}
