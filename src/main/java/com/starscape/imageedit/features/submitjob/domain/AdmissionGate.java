package com.starscape.imageedit.features.submitjob.domain;

import com.starscape.imageedit.common.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of remote tasks that are outstanding at once.
 *
 * A grant is acquired before a remote call, bound to the task id once the
 * task exists, and released exactly once when the task reports back or expires.
 * Grants whose dispatch failed before a task id existed go back through
 * {@link #releaseUnbound()}.
 */
@Component
public class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final int capacity;
    private final Semaphore permits;
    private final Set<String> boundTasks = ConcurrentHashMap.newKeySet();
    private final AtomicInteger unboundGrants = new AtomicInteger();

    @Autowired
    public AdmissionGate(OrchestratorProperties properties) {
        this(properties.getMaxInflight());
    }

    public AdmissionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a grant is free.
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        unboundGrants.incrementAndGet();
    }

    /**
     * Hands the grant acquired by the calling dispatch over to {@code taskId}.
     */
    public void bind(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id is required");
        }
        if (!boundTasks.add(taskId)) {
            throw new IllegalStateException("Task " + taskId + " already holds a grant");
        }
        if (unboundGrants.getAndUpdate(n -> n > 0 ? n - 1 : n) == 0) {
            boundTasks.remove(taskId);
            throw new IllegalStateException("No acquired grant to bind to task " + taskId);
        }
    }

    public ReleaseResult release(String taskId) {
        if (taskId != null && boundTasks.remove(taskId)) {
            permits.release();
            return ReleaseResult.RELEASED;
        }
        log.debug("Grant already released: taskId={}", taskId);
        return ReleaseResult.ALREADY_RELEASED;
    }

    public void releaseUnbound() {
        if (unboundGrants.getAndUpdate(n -> n > 0 ? n - 1 : n) == 0) {
            throw new IllegalStateException("No unbound grant to release");
        }
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        return capacity - permits.availablePermits();
    }

    public int available() {
        return permits.availablePermits();
    }
}
