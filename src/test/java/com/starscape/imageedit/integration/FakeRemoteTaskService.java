package com.starscape.imageedit.integration;

import com.starscape.imageedit.features.remotetask.domain.NodeInfo;
import com.starscape.imageedit.features.remotetask.domain.RemoteTaskService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for RunningHub: records created tasks and serves a fixed PNG for every download.
 */
public class FakeRemoteTaskService implements RemoteTaskService {

    private final AtomicInteger sequence = new AtomicInteger();
    private final List<String> createdTasks = new CopyOnWriteArrayList<>();
    private final Map<String, List<NodeInfo>> nodesByTask = new ConcurrentHashMap<>();

    @Override
    public String upload(byte[] content, String filename, String fileType) {
        return "api/" + sequence.incrementAndGet() + "-" + filename;
    }

    @Override
    public String createTask(String workflowId, List<NodeInfo> nodeInfoList) {
        String taskId = "task-" + sequence.incrementAndGet();
        nodesByTask.put(taskId, List.copyOf(nodeInfoList));
        createdTasks.add(taskId);
        return taskId;
    }

    @Override
    public byte[] download(String url) {
        try {
            return TestUtils.createTestPngImage(32, 32);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public List<String> createdTasks() {
        return createdTasks;
    }

    public List<NodeInfo> nodesOf(String taskId) {
        return nodesByTask.get(taskId);
    }
}
