package com.starscape.imageedit.features.submitjob.app;

import com.starscape.imageedit.common.config.ExecutorConfig;
import com.starscape.imageedit.common.config.ExtractionProperties;
import com.starscape.imageedit.common.config.OrchestratorProperties;
import com.starscape.imageedit.common.config.RemoteServiceProperties;
import com.starscape.imageedit.features.extractpatches.app.PatchExtractor;
import com.starscape.imageedit.features.extractpatches.domain.CoordinateOrigin;
import com.starscape.imageedit.features.extractpatches.domain.Patch;
import com.starscape.imageedit.features.remotetask.domain.NodeInfo;
import com.starscape.imageedit.features.remotetask.domain.RemoteTaskService;
import com.starscape.imageedit.features.submitjob.domain.AdmissionGate;
import com.starscape.imageedit.features.submitjob.domain.TaskMeta;
import com.starscape.imageedit.features.submitjob.domain.TaskRegistry;
import com.starscape.imageedit.features.trackprogress.app.JobRegistry;
import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;
import com.starscape.imageedit.features.trackprogress.domain.JobKind;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import com.starscape.imageedit.features.trackprogress.domain.PartStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Turns edit requests into remote tasks.
 *
 * A whole-image job is one task on the single-image workflow. A batch job is one
 * task per extracted patch on the batch workflow. Both entry points return at
 * once; extraction and remote calls run on the submission pool, and every remote
 * call first takes a grant from the {@link AdmissionGate}.
 */
@Service
public class EditJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EditJobDispatcher.class);

    static final String IMAGE_PART_ID = "0";
    static final String FILE_TYPE_IMAGE = "image";

    private final AdmissionGate admissionGate;
    private final TaskRegistry taskRegistry;
    private final JobRegistry jobRegistry;
    private final RemoteTaskService remoteTaskService;
    private final PatchExtractor patchExtractor;
    private final RemoteServiceProperties remoteProperties;
    private final ExtractionProperties extractionProperties;
    private final Duration taskTimeout;
    private final Executor submissionExecutor;
    private final List<TaskRegistrationListener> registrationListeners;

    public EditJobDispatcher(
            AdmissionGate admissionGate,
            TaskRegistry taskRegistry,
            JobRegistry jobRegistry,
            RemoteTaskService remoteTaskService,
            PatchExtractor patchExtractor,
            RemoteServiceProperties remoteProperties,
            ExtractionProperties extractionProperties,
            OrchestratorProperties orchestratorProperties,
            @Qualifier(ExecutorConfig.SUBMISSION_EXECUTOR) Executor submissionExecutor,
            List<TaskRegistrationListener> registrationListeners) {
        this.admissionGate = admissionGate;
        this.taskRegistry = taskRegistry;
        this.jobRegistry = jobRegistry;
        this.remoteTaskService = remoteTaskService;
        this.patchExtractor = patchExtractor;
        this.remoteProperties = remoteProperties;
        this.extractionProperties = extractionProperties;
        this.taskTimeout = orchestratorProperties.getTaskTimeout();
        this.submissionExecutor = submissionExecutor;
        this.registrationListeners = List.copyOf(registrationListeners);
    }

    public JobHandle submitImageJob(Path imagePath) {
        return submitImageJob(imagePath, null);
    }

    /**
     * @param hook called once with the job's final state, may be null
     */
    public JobHandle submitImageJob(Path imagePath, Consumer<JobCompletion> hook) {
        String jobId = JobRegistry.newJobId();
        jobRegistry.openJob(jobId, JobKind.IMAGE, imagePath.toString(), hook);
        jobRegistry.fixExpected(jobId, 1);
        log.info("Image job submitted: jobId={}, image={}", jobId, imagePath);

        CompletableFuture<DispatchReport> dispatch;
        try {
            dispatch = CompletableFuture.supplyAsync(() -> dispatchImage(jobId, imagePath), submissionExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Submission pool rejected image job: jobId={}", jobId, e);
            jobRegistry.reduceExpected(jobId,
                PartOutcome.failed(IMAGE_PART_ID, null, PartStatus.DISPATCH_FAILED, "Submission rejected"));
            dispatch = CompletableFuture.failedFuture(new DispatchException(jobId, "Submission rejected", e));
        }
        return new JobHandle(jobId, dispatch);
    }

    public JobHandle submitBatchJob(Path imagePath, Path configPath) {
        return submitBatchJob(imagePath, configPath, null, null);
    }

    /**
     * @param origin coordinate origin of the region points, null for the configured default
     * @param hook   called once with the job's final state, may be null
     */
    public JobHandle submitBatchJob(Path imagePath, Path configPath, CoordinateOrigin origin,
                                    Consumer<JobCompletion> hook) {
        CoordinateOrigin effectiveOrigin = origin != null ? origin : extractionProperties.getCoordinateOrigin();
        String jobId = JobRegistry.newJobId();
        jobRegistry.openJob(jobId, JobKind.BATCH, imagePath.toString(), hook);
        log.info("Batch job submitted: jobId={}, image={}, config={}, origin={}",
            jobId, imagePath, configPath, effectiveOrigin.label());

        CompletableFuture<DispatchReport> dispatch;
        try {
            dispatch = CompletableFuture.supplyAsync(
                () -> dispatchBatch(jobId, imagePath, configPath, effectiveOrigin), submissionExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Submission pool rejected batch job: jobId={}", jobId, e);
            jobRegistry.failBeforeDispatch(jobId,
                PartOutcome.failed("*", null, PartStatus.DISPATCH_FAILED, "Submission rejected"));
            dispatch = CompletableFuture.failedFuture(new DispatchException(jobId, "Submission rejected", e));
        }
        return new JobHandle(jobId, dispatch);
    }

    private DispatchReport dispatchImage(String jobId, Path imagePath) {
        RemoteServiceProperties.Workflow workflow = remoteProperties.getSingle();
        try {
            byte[] content = Files.readAllBytes(imagePath);
            String taskId = dispatchTask(jobId, IMAGE_PART_ID, content, imagePath.getFileName().toString(),
                workflow.getWorkflowId(),
                fileRef -> List.of(new NodeInfo(workflow.getImageNodeId(), workflow.getImageFieldName(), fileRef)),
                OutputPaths.forImage(imagePath), false);
            return new DispatchReport(jobId, Map.of(IMAGE_PART_ID, taskId), Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw imageDispatchFailed(jobId, e);
        } catch (IOException | RuntimeException e) {
            throw imageDispatchFailed(jobId, e);
        }
    }

    private DispatchException imageDispatchFailed(String jobId, Exception e) {
        String message = describe(e);
        log.error("Image dispatch failed: jobId={}, error={}", jobId, message, e);
        jobRegistry.reduceExpected(jobId,
            PartOutcome.failed(IMAGE_PART_ID, null, PartStatus.DISPATCH_FAILED, message));
        return new DispatchException(jobId, "Image dispatch failed: " + message, e);
    }

    private DispatchReport dispatchBatch(String jobId, Path imagePath, Path configPath, CoordinateOrigin origin) {
        List<Patch> patches;
        try {
            patches = patchExtractor.extract(imagePath, configPath, origin);
        } catch (IOException | RuntimeException e) {
            String message = describe(e);
            log.error("Patch extraction failed: jobId={}, image={}, config={}, error={}",
                jobId, imagePath, configPath, message, e);
            jobRegistry.failBeforeDispatch(jobId,
                PartOutcome.failed("*", null, PartStatus.DISPATCH_FAILED, "Extraction failed: " + message));
            throw new DispatchException(jobId, "Extraction failed: " + message, e);
        }

        jobRegistry.fixExpected(jobId, patches.size());
        if (patches.isEmpty()) {
            log.info("No regions to edit, job completed empty: jobId={}", jobId);
            return new DispatchReport(jobId, Map.of(), Map.of());
        }

        RemoteServiceProperties.Workflow workflow = remoteProperties.getBatch();
        Map<String, String> dispatched = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (Patch patch : patches) {
            String failure;
            if (Thread.currentThread().isInterrupted()) {
                failure = "Dispatch interrupted";
            } else {
                try {
                    String taskId = dispatchTask(jobId, patch.partId(), patch.pngBytes(),
                        "region" + patch.partId() + ".png",
                        workflow.getWorkflowId(),
                        fileRef -> List.of(
                            new NodeInfo(workflow.getPromptNodeId(), workflow.getPromptFieldName(), patch.prompt()),
                            new NodeInfo(workflow.getImageNodeId(), workflow.getImageFieldName(), fileRef)),
                        OutputPaths.forPatch(imagePath, patch.partId()), true);
                    dispatched.put(patch.partId(), taskId);
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failure = "Dispatch interrupted";
                } catch (RuntimeException e) {
                    failure = describe(e);
                    log.error("Patch dispatch failed: jobId={}, partId={}, error={}", jobId, patch.partId(), failure, e);
                }
            }
            failed.put(patch.partId(), failure);
            jobRegistry.reduceExpected(jobId,
                PartOutcome.failed(patch.partId(), null, PartStatus.DISPATCH_FAILED, failure));
        }

        log.info("Batch dispatched: jobId={}, dispatched={}, failed={}", jobId, dispatched.size(), failed.size());
        return new DispatchReport(jobId, dispatched, failed);
    }

    /**
     * Acquires a grant, uploads the input and creates the remote task.
     *
     * @param nodesFor builds the workflow node parameters from the uploaded file reference
     * @return the remote task id, bound to the grant and registered
     */
    private String dispatchTask(String jobId, String partId, byte[] content, String filename,
                                String workflowId, Function<String, List<NodeInfo>> nodesFor, String output,
                                boolean feather) throws InterruptedException {
        admissionGate.acquire();
        String taskId;
        try {
            String fileRef = remoteTaskService.upload(content, filename, FILE_TYPE_IMAGE);
            taskId = remoteTaskService.createTask(workflowId, nodesFor.apply(fileRef));
            admissionGate.bind(taskId);
        } catch (RuntimeException e) {
            admissionGate.releaseUnbound();
            throw e;
        }

        Instant now = Instant.now();
        TaskMeta meta = new TaskMeta(taskId, output, jobId, partId, feather, now, now.plus(taskTimeout));
        taskRegistry.register(meta);
        log.info("Task dispatched: jobId={}, partId={}, taskId={}, inflight={}",
            jobId, partId, taskId, admissionGate.inUse());
        notifyRegistered(meta);
        return taskId;
    }

    private void notifyRegistered(TaskMeta meta) {
        for (TaskRegistrationListener listener : registrationListeners) {
            try {
                listener.onTaskRegistered(meta);
            } catch (RuntimeException e) {
                log.error("Registration listener failed: taskId={}, listener={}",
                    meta.taskId(), listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
