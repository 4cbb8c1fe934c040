package com.starscape.imageedit.features.remotetask.domain;

/**
 * One input override for a workflow node.
 */
public record NodeInfo(
    String nodeId,
    String fieldName,
    String fieldValue
) {}
