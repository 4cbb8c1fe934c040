package com.starscape.imageedit.features.remotetask.infra.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadData(
    String fileName,
    String fileType
) {}
