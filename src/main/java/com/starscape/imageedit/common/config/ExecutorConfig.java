package com.starscape.imageedit.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * The two worker pools of the orchestrator.
 * Submission work (extraction, upload, task creation) and callback work
 * (download, feather, save, aggregate) never share threads, so a slow remote
 * service cannot stall webhook ingestion.
 */
@Configuration
public class ExecutorConfig {

    public static final String SUBMISSION_EXECUTOR = "submissionExecutor";
    public static final String CALLBACK_EXECUTOR = "callbackExecutor";

    @Bean(name = SUBMISSION_EXECUTOR)
    public ThreadPoolTaskExecutor submissionExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getSubmitWorkers());
        executor.setMaxPoolSize(properties.getSubmitWorkers());
        executor.setQueueCapacity(properties.getSubmitQueueCapacity());
        executor.setThreadNamePrefix("submit-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownAwait().toSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Overflow is rejected rather than run on the caller, so the webhook thread
     * never downloads or writes. The handler counts a rejected completion as failed.
     */
    @Bean(name = CALLBACK_EXECUTOR)
    public ThreadPoolTaskExecutor callbackExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCallbackWorkers());
        executor.setMaxPoolSize(properties.getCallbackWorkers());
        executor.setQueueCapacity(properties.getCallbackQueueCapacity());
        executor.setThreadNamePrefix("callback-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownAwait().toSeconds());
        executor.initialize();
        return executor;
    }
}
