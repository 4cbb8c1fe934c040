package com.starscape.imageedit.features.remotetask.infra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTaskData(
    String taskId,
    String taskStatus,
    String clientId
) {}
