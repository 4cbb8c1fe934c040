package com.starscape.imageedit.features.trackprogress.app;

import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;
import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;

/**
 * Registry-wide observer of job progress. Called outside every registry lock.
 */
public interface JobCompletionListener {

    void onJobCompleted(JobCompletion completion);

    default void onPartRecorded(PartOutcome outcome, JobSnapshot job) {
    }
}
