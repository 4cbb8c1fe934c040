package com.starscape.imageedit.common.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorConfigTest {

    @Test
    void saturatedCallbackPoolRejectsInsteadOfRunningOnCaller() throws Exception {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setCallbackWorkers(1);
        properties.setCallbackQueueCapacity(1);
        ThreadPoolTaskExecutor executor = new ExecutorConfig().callbackExecutor(properties);
        CountDownLatch release = new CountDownLatch(1);
        Thread caller = Thread.currentThread();
        try {
            assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class,
                executor.getThreadPoolExecutor().getRejectedExecutionHandler());

            executor.execute(() -> awaitQuietly(release));
            executor.execute(() -> awaitQuietly(release));
            assertThrows(TaskRejectedException.class, () -> executor.execute(() -> {
                if (Thread.currentThread() == caller) {
                    fail("ran on the caller thread");
                }
            }));
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
