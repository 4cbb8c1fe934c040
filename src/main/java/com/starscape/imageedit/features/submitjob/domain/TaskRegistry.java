package com.starscape.imageedit.features.submitjob.domain;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outstanding remote tasks keyed by task id. An entry is consumed exactly once,
 * either by its callback or by expiry.
 */
@Component
public class TaskRegistry {

    private final Object lock = new Object();
    private final Map<String, TaskMeta> tasks = new HashMap<>();

    public void register(TaskMeta meta) {
        synchronized (lock) {
            TaskMeta previous = tasks.putIfAbsent(meta.taskId(), meta);
            if (previous != null) {
                throw new IllegalStateException("Task already registered: " + meta.taskId());
            }
        }
    }

    public Optional<TaskMeta> find(String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(taskId));
        }
    }

    public Optional<TaskMeta> remove(String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.remove(taskId));
        }
    }

    public List<TaskMeta> removeExpired(Instant now) {
        List<TaskMeta> expired = new ArrayList<>();
        synchronized (lock) {
            Iterator<TaskMeta> it = tasks.values().iterator();
            while (it.hasNext()) {
                TaskMeta meta = it.next();
                if (meta.isExpired(now)) {
                    expired.add(meta);
                    it.remove();
                }
            }
        }
        return expired;
    }

    public int size() {
        synchronized (lock) {
            return tasks.size();
        }
    }
}
