package com.starscape.imageedit.features.remotetask.infra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response envelope of every RunningHub OpenAPI call; code 0 means success.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunningHubResponse<T>(
    int code,
    String msg,
    T data
) {
    public boolean isSuccess() {
        return code == 0;
    }
}
