package com.starscape.imageedit.features.trackprogress.app;

import com.starscape.imageedit.features.trackprogress.api.dto.JobStatusUpdate;
import com.starscape.imageedit.features.trackprogress.api.dto.PartProgressUpdate;
import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;
import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for broadcasting progress updates via WebSocket.
 * Clients subscribe to /topic/job/{jobId}.
 */
@Service
public class ProgressBroadcaster implements JobCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    static final String JOB_TOPIC_PREFIX = "/topic/job/";

    private final SimpMessagingTemplate messagingTemplate;

    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onPartRecorded(PartOutcome outcome, JobSnapshot job) {
        PartProgressUpdate update = PartProgressUpdate.of(outcome, job);
        String destination = JOB_TOPIC_PREFIX + update.jobId();
        messagingTemplate.convertAndSend(destination, update);
        log.debug("Broadcasted part progress to {}: partId={}, status={}, done={}/{}",
            destination, update.partId(), update.status(), update.doneCount(), update.expected());
    }

    @Override
    public void onJobCompleted(JobCompletion completion) {
        JobStatusUpdate update = JobStatusUpdate.of(completion);
        String destination = JOB_TOPIC_PREFIX + update.jobId();
        messagingTemplate.convertAndSend(destination, update);
        log.info("Broadcasted job completion to {}: status={}, completed={}/{}, failed={}",
            destination, update.status(), update.completedCount(), update.totalCount(), update.failedCount());
    }
}
