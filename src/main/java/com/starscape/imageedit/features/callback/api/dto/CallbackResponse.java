package com.starscape.imageedit.features.callback.api.dto;

import com.starscape.imageedit.features.callback.domain.CallbackOutcome;

/**
 * Always returned with 200 so the remote service does not retry.
 */
public record CallbackResponse(boolean ok, CallbackOutcome outcome) {

    public static CallbackResponse of(CallbackOutcome outcome) {
        return new CallbackResponse(true, outcome);
    }
}
