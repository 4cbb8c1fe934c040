package com.starscape.imageedit.features.trackprogress.api;

import com.starscape.imageedit.features.trackprogress.api.dto.JobStatusResponse;
import com.starscape.imageedit.features.trackprogress.app.GetJobStatusHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/queries/edit-jobs")
public class JobStatusController {

    private final GetJobStatusHandler getJobStatusHandler;

    public JobStatusController(GetJobStatusHandler getJobStatusHandler) {
        this.getJobStatusHandler = getJobStatusHandler;
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(getJobStatusHandler.handle(jobId));
    }
}
