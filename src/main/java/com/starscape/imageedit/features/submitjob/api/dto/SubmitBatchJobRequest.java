package com.starscape.imageedit.features.submitjob.api.dto;

import com.starscape.imageedit.features.extractpatches.domain.CoordinateOrigin;
import jakarta.validation.constraints.NotBlank;

/**
 * @param coordinateOrigin "top-left" or "bottom-left"; the configured default when omitted
 */
public record SubmitBatchJobRequest(
    @NotBlank(message = "imagePath is required")
    String imagePath,

    @NotBlank(message = "configPath is required")
    String configPath,

    CoordinateOrigin coordinateOrigin
) {}
