package com.starscape.imageedit.features.remotetask.infra.dto;

import com.starscape.imageedit.features.remotetask.domain.NodeInfo;

import java.util.List;

public record CreateTaskRequest(
    String apiKey,
    String workflowId,
    List<NodeInfo> nodeInfoList,
    String webhookUrl
) {}
