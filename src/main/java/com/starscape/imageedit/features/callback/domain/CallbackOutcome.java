package com.starscape.imageedit.features.callback.domain;

public enum CallbackOutcome {
    /** First delivery for a known task, queued for processing. */
    ACCEPTED,
    /** Known task whose grant was already released by an earlier delivery. */
    DUPLICATE,
    /** Known task whose completion the callback pool refused; counted as failed without download. */
    REJECTED,
    /** No registered task; held briefly in case its registration is still in flight. */
    UNKNOWN_TASK,
    MISSING_TASK_ID
}
