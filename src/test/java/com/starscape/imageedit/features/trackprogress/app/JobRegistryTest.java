package com.starscape.imageedit.features.trackprogress.app;

import com.starscape.imageedit.features.trackprogress.domain.JobCompletion;
import com.starscape.imageedit.features.trackprogress.domain.JobKind;
import com.starscape.imageedit.features.trackprogress.domain.JobSnapshot;
import com.starscape.imageedit.features.trackprogress.domain.JobStatus;
import com.starscape.imageedit.features.trackprogress.domain.PartOutcome;
import com.starscape.imageedit.features.trackprogress.domain.PartStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private final List<JobCompletion> completions = new CopyOnWriteArrayList<>();
    private final List<PartOutcome> partEvents = new CopyOnWriteArrayList<>();
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        JobCompletionListener listener = new JobCompletionListener() {
            @Override
            public void onJobCompleted(JobCompletion completion) {
                completions.add(completion);
            }

            @Override
            public void onPartRecorded(PartOutcome outcome, JobSnapshot job) {
                partEvents.add(outcome);
            }
        };
        registry = new JobRegistry(List.of(listener), 10);
    }

    private static PartOutcome ok(String partId, String taskId) {
        return PartOutcome.succeeded(partId, taskId, "/out/" + partId + ".png");
    }

    @Test
    void completesExactlyWhenDoneReachesExpected() {
        String jobId = registry.startJob(2);

        assertFalse(registry.markPartDone(jobId, "t1", ok("0", "t1")));
        assertTrue(registry.markPartDone(jobId, "t2", ok("1", "t2")));

        assertEquals(1, completions.size());
        JobCompletion completion = completions.get(0);
        assertEquals(JobStatus.COMPLETED, completion.status());
        assertEquals(2, completion.succeededCount());
        assertEquals(0, registry.activeCount());
    }

    @Test
    void repeatedPartKeyDoesNotChangeDone() {
        String jobId = registry.startJob(2);

        registry.markPartDone(jobId, "t1", ok("0", "t1"));
        registry.markPartDone(jobId, "t1", ok("0", "t1"));

        JobSnapshot snapshot = registry.find(jobId).orElseThrow();
        assertEquals(1, snapshot.doneCount());
        assertEquals(JobStatus.IN_PROGRESS, snapshot.status());
        assertEquals(1, partEvents.size());
        assertTrue(completions.isEmpty());
    }

    @Test
    void zeroExpectedCompletesImmediately() {
        String jobId = registry.startJob(0);

        assertEquals(1, completions.size());
        assertEquals(jobId, completions.get(0).jobId());
        assertEquals(JobStatus.COMPLETED, completions.get(0).status());
        assertTrue(completions.get(0).parts().isEmpty());
    }

    @Test
    void partialFailureIsReportedInCompletion() {
        String jobId = registry.startJob(2);

        registry.markPartDone(jobId, "t1", ok("0", "t1"));
        registry.markPartDone(jobId, "t2",
            PartOutcome.failed("1", "t2", PartStatus.REMOTE_FAILED, "Remote code 805"));

        JobCompletion completion = completions.get(0);
        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, completion.status());
        assertEquals(1, completion.failedCount());
    }

    @Test
    void reduceExpectedCanCompleteJob() {
        String jobId = registry.startJob(2);
        registry.markPartDone(jobId, "t1", ok("0", "t1"));

        assertTrue(registry.reduceExpected(jobId,
            PartOutcome.failed("1", null, PartStatus.DISPATCH_FAILED, "boom")));

        JobCompletion completion = completions.get(0);
        assertEquals(1, completion.expected());
        assertEquals(2, completion.parts().size());
        assertEquals(JobStatus.COMPLETED_WITH_ERRORS, completion.status());
    }

    @Test
    void failBeforeDispatchCompletesAsFailed() {
        String jobId = JobRegistry.newJobId();
        registry.openJob(jobId, JobKind.BATCH, "/img.png", null);

        registry.failBeforeDispatch(jobId,
            PartOutcome.failed("*", null, PartStatus.DISPATCH_FAILED, "Extraction failed"));

        assertEquals(JobStatus.FAILED, completions.get(0).status());
        assertEquals(0, completions.get(0).expected());
    }

    @Test
    void openJobIsQueuedUntilExpectedIsFixed() {
        String jobId = JobRegistry.newJobId();
        registry.openJob(jobId, JobKind.BATCH, "/img.png", null);

        assertEquals(JobStatus.QUEUED, registry.find(jobId).orElseThrow().status());
        assertNull(registry.find(jobId).orElseThrow().expected());
    }

    @Test
    void completedJobsStayQueryable() {
        String jobId = registry.startJob(1);
        registry.markPartDone(jobId, "t1", ok("0", "t1"));

        JobSnapshot snapshot = registry.find(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, snapshot.status());
        assertEquals(1, snapshot.doneCount());
        assertNotNull(snapshot.completedAt());
    }

    @Test
    void completedHistoryIsBounded() {
        String first = registry.startJob(0);
        for (int i = 0; i < 10; i++) {
            registry.startJob(0);
        }

        assertTrue(registry.find(first).isEmpty());
    }

    @Test
    void throwingHookDoesNotAffectRegistryOrListeners() {
        String jobId = JobRegistry.newJobId();
        registry.openJob(jobId, JobKind.IMAGE, "/img.png", completion -> {
            throw new IllegalStateException("hook failure");
        });
        registry.fixExpected(jobId, 1);

        assertTrue(registry.markPartDone(jobId, "t1", ok("0", "t1")));
        assertEquals(1, completions.size());
        assertEquals(0, registry.activeCount());
    }

    @Test
    void hookFiresOnceUnderConcurrentMarks() throws Exception {
        AtomicInteger hookCalls = new AtomicInteger();
        String jobId = JobRegistry.newJobId();
        registry.openJob(jobId, JobKind.BATCH, "/img.png", completion -> hookCalls.incrementAndGet());
        registry.fixExpected(jobId, 20);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < 20; i++) {
            String taskId = "t" + i;
            for (int copy = 0; copy < 3; copy++) {
                pool.submit(() -> {
                    start.await();
                    return registry.markPartDone(jobId, taskId, ok(taskId, taskId));
                });
            }
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(1, hookCalls.get());
        assertEquals(1, completions.size());
        assertEquals(20, completions.get(0).parts().size());
    }
}
