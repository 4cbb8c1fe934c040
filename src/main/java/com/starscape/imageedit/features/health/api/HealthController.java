package com.starscape.imageedit.features.health.api;

import com.starscape.imageedit.features.submitjob.domain.AdmissionGate;
import com.starscape.imageedit.features.submitjob.domain.TaskRegistry;
import com.starscape.imageedit.features.trackprogress.app.JobRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
public class HealthController {

    private final AdmissionGate admissionGate;
    private final TaskRegistry taskRegistry;
    private final JobRegistry jobRegistry;

    public HealthController(AdmissionGate admissionGate, TaskRegistry taskRegistry, JobRegistry jobRegistry) {
        this.admissionGate = admissionGate;
        this.taskRegistry = taskRegistry;
        this.jobRegistry = jobRegistry;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> checkHealth() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "capacity", admissionGate.capacity(),
            "inflight", admissionGate.inUse(),
            "available", admissionGate.available(),
            "pendingTasks", taskRegistry.size(),
            "activeJobs", jobRegistry.activeCount()
        ));
    }
}
