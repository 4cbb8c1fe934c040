package com.starscape.imageedit.features.submitjob.app;

import com.starscape.imageedit.features.submitjob.domain.TaskMeta;

/**
 * Notified on the submission thread after a dispatched task is registered.
 */
public interface TaskRegistrationListener {

    void onTaskRegistered(TaskMeta meta);
}
