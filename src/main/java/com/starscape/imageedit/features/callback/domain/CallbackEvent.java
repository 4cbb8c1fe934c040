package com.starscape.imageedit.features.callback.domain;

/**
 * A remote task's completion report, parsed once at the edge.
 */
public sealed interface CallbackEvent
        permits CallbackEvent.Success, CallbackEvent.Failure, CallbackEvent.Malformed {

    String taskId();

    default boolean hasTaskId() {
        return taskId() != null && !taskId().isBlank();
    }

    record Success(String taskId, String fileUrl) implements CallbackEvent {
    }

    /**
     * The remote service reported a non-zero result code.
     */
    record Failure(String taskId, int code, String message) implements CallbackEvent {
    }

    /**
     * The payload could not be understood; taskId may be blank.
     */
    record Malformed(String taskId, String reason) implements CallbackEvent {
    }
}
