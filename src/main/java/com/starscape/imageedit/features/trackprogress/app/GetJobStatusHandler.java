package com.starscape.imageedit.features.trackprogress.app;

import com.starscape.imageedit.common.exception.NotFoundException;
import com.starscape.imageedit.features.trackprogress.api.dto.JobStatusResponse;
import org.springframework.stereotype.Service;

@Service
public class GetJobStatusHandler {

    private final JobRegistry jobRegistry;

    public GetJobStatusHandler(JobRegistry jobRegistry) {
        this.jobRegistry = jobRegistry;
    }

    public JobStatusResponse handle(String jobId) {
        return jobRegistry.find(jobId)
                .map(JobStatusResponse::of)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }
}
