package com.starscape.imageedit.features.submitjob.api.dto;

public record SubmitJobResponse(String jobId) {}
