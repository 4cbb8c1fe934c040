package com.starscape.imageedit.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for job orchestration.
 * Binds to app.orchestrator.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.orchestrator")
public class OrchestratorProperties {

    private int maxInflight = 30;
    private int submitWorkers = 8;
    private int submitQueueCapacity = 1000;
    private int callbackWorkers = 8;
    private int callbackQueueCapacity = 1000;
    private Duration taskTimeout = Duration.ofMinutes(30);
    private Duration expirySweepInterval = Duration.ofSeconds(30);
    private Duration shutdownAwait = Duration.ofSeconds(30);
    private int completedJobHistory = 500;
    private int earlyCallbackCapacity = 256;

    public int getMaxInflight() {
        return maxInflight;
    }

    public void setMaxInflight(int maxInflight) {
        this.maxInflight = maxInflight;
    }

    public int getSubmitWorkers() {
        return submitWorkers;
    }

    public void setSubmitWorkers(int submitWorkers) {
        this.submitWorkers = submitWorkers;
    }

    public int getSubmitQueueCapacity() {
        return submitQueueCapacity;
    }

    public void setSubmitQueueCapacity(int submitQueueCapacity) {
        this.submitQueueCapacity = submitQueueCapacity;
    }

    public int getCallbackWorkers() {
        return callbackWorkers;
    }

    public void setCallbackWorkers(int callbackWorkers) {
        this.callbackWorkers = callbackWorkers;
    }

    public int getCallbackQueueCapacity() {
        return callbackQueueCapacity;
    }

    public void setCallbackQueueCapacity(int callbackQueueCapacity) {
        this.callbackQueueCapacity = callbackQueueCapacity;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public Duration getExpirySweepInterval() {
        return expirySweepInterval;
    }

    public void setExpirySweepInterval(Duration expirySweepInterval) {
        this.expirySweepInterval = expirySweepInterval;
    }

    public Duration getShutdownAwait() {
        return shutdownAwait;
    }

    public void setShutdownAwait(Duration shutdownAwait) {
        this.shutdownAwait = shutdownAwait;
    }

    public int getCompletedJobHistory() {
        return completedJobHistory;
    }

    public void setCompletedJobHistory(int completedJobHistory) {
        this.completedJobHistory = completedJobHistory;
    }

    public int getEarlyCallbackCapacity() {
        return earlyCallbackCapacity;
    }

    public void setEarlyCallbackCapacity(int earlyCallbackCapacity) {
        this.earlyCallbackCapacity = earlyCallbackCapacity;
    }
}
