package com.starscape.imageedit.features.submitjob.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitImageJobRequest(
    @NotBlank(message = "imagePath is required")
    String imagePath
) {}
