package com.starscape.imageedit.features.submitjob.app;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the dispatch phase of a job achieved.
 *
 * @param dispatchedTasks part id to remote task id, in dispatch order
 * @param failedParts     part id to failure message
 */
public record DispatchReport(
    String jobId,
    Map<String, String> dispatchedTasks,
    Map<String, String> failedParts
) {
    public DispatchReport {
        dispatchedTasks = Collections.unmodifiableMap(new LinkedHashMap<>(dispatchedTasks));
        failedParts = Collections.unmodifiableMap(new LinkedHashMap<>(failedParts));
    }

    public int dispatchedCount() {
        return dispatchedTasks.size();
    }
}
