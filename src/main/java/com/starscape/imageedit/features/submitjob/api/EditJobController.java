package com.starscape.imageedit.features.submitjob.api;

import com.starscape.imageedit.features.submitjob.api.dto.SubmitBatchJobRequest;
import com.starscape.imageedit.features.submitjob.api.dto.SubmitImageJobRequest;
import com.starscape.imageedit.features.submitjob.api.dto.SubmitJobResponse;
import com.starscape.imageedit.features.submitjob.app.EditJobDispatcher;
import com.starscape.imageedit.features.submitjob.app.JobHandle;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

/**
 * Accepts edit jobs. Dispatch continues in the background; progress is
 * available from the job status query and the job's WebSocket topic.
 */
@RestController
@RequestMapping("/commands")
public class EditJobController {

    private final EditJobDispatcher dispatcher;

    public EditJobController(EditJobDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/edit-jobs")
    public ResponseEntity<SubmitJobResponse> submitImageJob(@Valid @RequestBody SubmitImageJobRequest request) {
        JobHandle handle = dispatcher.submitImageJob(Path.of(request.imagePath()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitJobResponse(handle.jobId()));
    }

    @PostMapping("/batch-edit-jobs")
    public ResponseEntity<SubmitJobResponse> submitBatchJob(@Valid @RequestBody SubmitBatchJobRequest request) {
        JobHandle handle = dispatcher.submitBatchJob(
            Path.of(request.imagePath()),
            Path.of(request.configPath()),
            request.coordinateOrigin(),
            null
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitJobResponse(handle.jobId()));
    }
}
