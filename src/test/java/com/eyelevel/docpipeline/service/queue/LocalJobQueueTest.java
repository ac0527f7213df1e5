package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.common.time.MutableClock;
import com.eyelevel.docpipeline.exception.DelayedRetryException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.model.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LocalJobQueueTest {

    @Mock
    private TaskScheduler scheduler;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final List<String> handled = new ArrayList<>();
    private final RecordingListener listener = new RecordingListener();

    private LocalJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = newQueue(QueueSettings.builder().backoffMs(2_000).build());
    }

    @Test
    void waitingJobsAreOrderedByPriorityThenInsertion() {
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("low").priority(4).build());
        queue.add("ocr-document", payload("doc-2"), JobOptions.builder().jobId("first").priority(2).build());
        queue.add("ocr-document", payload("doc-3"), JobOptions.builder().jobId("second").priority(2).build());

        assertThat(queue.getWaiting()).extracting(QueueJob::getId).containsExactly("first", "second", "low");
    }

    @Test
    void handlerProcessesJobsInDispatchOrder() {
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("b").priority(3).build());
        queue.add("ocr-document", payload("doc-2"), JobOptions.builder().jobId("a").priority(1).build());

        queue.setHandler(succeeding());

        assertThat(handled).containsExactly("a", "b");
        JobCounts counts = queue.getCounts();
        assertEquals(2, counts.completed());
        assertEquals(0, counts.waiting());
        assertEquals(Map.of("ok", true), queue.getJob("a").orElseThrow().getReturnValue());
        assertThat(listener.completed).containsExactly("a", "b");
    }

    @Test
    void addingAQueuedIdIsIgnored() {
        String first = queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());
        String second = queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertEquals("job-1", first);
        assertEquals("job-1", second);
        assertEquals(1, queue.getWaiting().size());
    }

    @Test
    void addingAFinishedIdRunsItAgain() {
        queue.setHandler(succeeding());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertThat(handled).containsExactly("job-1", "job-1");
        assertEquals(1, queue.getCounts().completed());
    }

    @Test
    void failedAttemptIsRetriedWithBackoffUntilAttemptsAreUsed() {
        queue.setHandler((job, progress) -> {
            handled.add(job.getId());
            throw new IllegalStateException("connection reset");
        });
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").attempts(2).build());

        QueueJob afterFirst = queue.getJob("job-1").orElseThrow();
        assertEquals(QueueJobState.DELAYED, afterFirst.getState());
        assertEquals(1, afterFirst.getAttemptsMade());
        assertTrue(listener.failed.isEmpty());

        ArgumentCaptor<Runnable> promotion = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(promotion.capture(), eq(clock.instant().plusMillis(2_000)));
        promotion.getValue().run();

        QueueJob afterSecond = queue.getJob("job-1").orElseThrow();
        assertEquals(QueueJobState.FAILED, afterSecond.getState());
        assertEquals(2, afterSecond.getAttemptsMade());
        assertEquals("connection reset", afterSecond.getFailedReason());
        assertThat(handled).hasSize(2);
        assertThat(listener.failed).containsExactly("job-1");
    }

    @Test
    void unrecoverableFailureIsNotRetried() {
        queue.setHandler((job, progress) -> {
            throw new UnrecoverableJobException("Unsupported file type for OCR: text/plain", null);
        });
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").attempts(3).build());

        QueueJob job = queue.getJob("job-1").orElseThrow();
        assertEquals(QueueJobState.FAILED, job.getState());
        assertEquals(1, job.getAttemptsMade());
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertThat(listener.failed).containsExactly("job-1");
    }

    @Test
    void delayedRetryDoesNotConsumeAnAttempt() {
        queue.setHandler((job, progress) -> {
            throw new DelayedRetryException("Rate exceeded", 60_000, null);
        });
        queue.add("embedding", payload("doc-1"), JobOptions.builder().jobId("job-1").attempts(1).build());

        QueueJob job = queue.getJob("job-1").orElseThrow();
        assertEquals(QueueJobState.DELAYED, job.getState());
        assertEquals(0, job.getAttemptsMade());
        verify(scheduler).schedule(any(Runnable.class), eq(clock.instant().plusMillis(60_000)));
        assertTrue(listener.failed.isEmpty());
    }

    @Test
    void delayedJobIsNotDispatchedUntilPromoted() {
        queue.setHandler(succeeding());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").delayMs(5_000L).build());

        assertTrue(handled.isEmpty());
        assertThat(queue.getDelayed()).extracting(QueueJob::getId).containsExactly("job-1");
        assertEquals(1, queue.getCounts().delayed());

        ArgumentCaptor<Runnable> promotion = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(promotion.capture(), eq(clock.instant().plusMillis(5_000)));
        promotion.getValue().run();

        assertThat(handled).containsExactly("job-1");
    }

    @Test
    void activeJobCannotBeRemoved() {
        AtomicReference<Throwable> removalError = new AtomicReference<>();
        queue.setHandler((job, progress) -> {
            removalError.set(assertThrows(JobStateException.class, () -> queue.remove(job.getId())));
            return Map.of();
        });

        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertInstanceOf(JobStateException.class, removalError.get());
        assertEquals(QueueJobState.COMPLETED, queue.getJob("job-1").orElseThrow().getState());
    }

    @Test
    void removeDropsWaitingJob() {
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertTrue(queue.remove("job-1"));
        assertFalse(queue.remove("job-1"));
        assertTrue(queue.getJob("job-1").isEmpty());
    }

    @Test
    void pausedQueueHoldsJobsUntilResumed() {
        queue.setHandler(succeeding());
        queue.pause();
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertTrue(queue.isPaused());
        assertTrue(handled.isEmpty());
        assertEquals(1, queue.getCounts().waiting());

        queue.resume();

        assertFalse(queue.isPaused());
        assertThat(handled).containsExactly("job-1");
    }

    @Test
    void rateLimitDefersDispatchToWindowEnd() {
        queue = newQueue(QueueSettings.builder().rateLimitMax(1).rateLimitDurationMs(60_000).build());
        queue.setHandler(succeeding());

        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());
        queue.add("ocr-document", payload("doc-2"), JobOptions.builder().jobId("job-2").build());

        assertThat(handled).containsExactly("job-1");
        assertEquals(1, queue.getCounts().waiting());
        ArgumentCaptor<Runnable> wakeUp = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(wakeUp.capture(), eq(clock.instant().plusMillis(60_000)));

        clock.advanceMillis(60_000);
        wakeUp.getValue().run();

        assertThat(handled).containsExactly("job-1", "job-2");
    }

    @Test
    void cleanRemovesOnlyFinishedJobsOlderThanGrace() {
        queue.setHandler(succeeding());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("old").build());
        clock.advance(Duration.ofHours(2));
        queue.add("ocr-document", payload("doc-2"), JobOptions.builder().jobId("recent").build());

        List<String> removed = queue.clean(Duration.ofHours(1).toMillis(), 1000, QueueJobState.COMPLETED);

        assertThat(removed).containsExactly("old");
        assertTrue(queue.getJob("old").isEmpty());
        assertTrue(queue.getJob("recent").isPresent());
    }

    @Test
    void cleanRejectsUnfinishedStates() {
        assertThrows(IllegalArgumentException.class, () -> queue.clean(0, 10, QueueJobState.WAITING));
    }

    @Test
    void progressIsBoundedAndForwardedToListeners() {
        queue.setHandler((job, progress) -> {
            progress.report(50);
            progress.report(150);
            return Map.of();
        });

        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertThat(listener.progress).containsExactly(50, 100);
        assertThat(listener.active).containsExactly("job-1");
    }

    @Test
    void stalledJobReleasesItsSlotAndFailsOnceItStallsAgain() {
        List<Runnable> swallowed = new ArrayList<>();
        queue = newQueue(stallingSettings(), swallowed::add);
        Runnable watchdog = captureWatchdog();
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());
        queue.add("ocr-document", payload("doc-2"), JobOptions.builder().jobId("job-2").build());
        queue.setHandler(succeeding());

        tick(watchdog);

        assertThat(listener.stalled).containsExactly("job-1");
        assertEquals(QueueJobState.ACTIVE, queue.getJob("job-1").orElseThrow().getState());
        assertEquals(0, queue.getJob("job-1").orElseThrow().getAttemptsMade());
        assertEquals(QueueJobState.WAITING, queue.getJob("job-2").orElseThrow().getState());

        tick(watchdog);

        QueueJob failedJob = queue.getJob("job-1").orElseThrow();
        assertEquals(QueueJobState.FAILED, failedJob.getState());
        assertEquals(LocalJobQueue.STALLED_REASON, failedJob.getFailedReason());
        assertThat(listener.failed).containsExactly("job-1");
        assertEquals(QueueJobState.ACTIVE, queue.getJob("job-2").orElseThrow().getState());
        assertEquals(1, queue.getCounts().active());

        tick(watchdog);
        tick(watchdog);
        tick(watchdog);

        assertThat(listener.failed).containsExactly("job-1", "job-2");
        assertEquals(0, queue.getCounts().active());
        assertEquals(2, queue.getCounts().failed());
        assertThat(swallowed).hasSize(4);
    }

    @Test
    void lateOutcomeOfAStalledRunIsIgnored() {
        List<Runnable> runs = new ArrayList<>();
        queue = newQueue(stallingSettings(), runs::add);
        Runnable watchdog = captureWatchdog();
        queue.setHandler(succeeding());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        tick(watchdog);
        assertThat(runs).hasSize(2);

        runs.get(0).run();

        assertThat(handled).containsExactly("job-1");
        assertEquals(QueueJobState.ACTIVE, queue.getJob("job-1").orElseThrow().getState());
        assertEquals(0, queue.getCounts().completed());
        assertEquals(1, queue.getCounts().active());

        runs.get(1).run();

        assertEquals(QueueJobState.COMPLETED, queue.getJob("job-1").orElseThrow().getState());
        assertEquals(1, queue.getCounts().completed());
        assertEquals(0, queue.getCounts().active());
        assertThat(listener.completed).containsExactly("job-1");
    }

    @Test
    void heartbeatKeepsALongRunningJobAlive() {
        queue = newQueue(stallingSettings(), new SyncTaskExecutor());
        Runnable watchdog = captureWatchdog();
        queue.setHandler((job, progress) -> {
            for (int i = 0; i < 5; i++) {
                clock.advanceMillis(800);
                progress.heartbeat();
                watchdog.run();
            }
            return Map.of();
        });

        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        assertTrue(listener.stalled.isEmpty());
        assertEquals(QueueJobState.COMPLETED, queue.getJob("job-1").orElseThrow().getState());
    }

    private QueueSettings stallingSettings() {
        return QueueSettings.builder().concurrency(1).stalledIntervalMs(1_000).build();
    }

    private Runnable captureWatchdog() {
        ArgumentCaptor<Runnable> watchdog = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(watchdog.capture(), eq(Duration.ofMillis(1_000)));
        return watchdog.getValue();
    }

    private void tick(Runnable watchdog) {
        clock.advanceMillis(10_000);
        watchdog.run();
    }

    private LocalJobQueue newQueue(QueueSettings settings) {
        return newQueue(settings, new SyncTaskExecutor());
    }

    private LocalJobQueue newQueue(QueueSettings settings, TaskExecutor executor) {
        LocalJobQueue created = new LocalJobQueue(QueueName.OCR, settings, executor, scheduler, clock);
        created.addListener(listener);
        return created;
    }

    private JobHandler succeeding() {
        return (job, progress) -> {
            handled.add(job.getId());
            return Map.of("ok", true);
        };
    }

    private static JobPayload payload(String documentId) {
        return JobPayload.builder()
                .documentId(documentId)
                .s3Key("org-1/" + documentId + "/file.pdf")
                .organizationId("org-1")
                .jobType(JobType.OCR)
                .options(Map.of())
                .build();
    }

    private static final class RecordingListener implements QueueEventListener {
        private final List<String> active = new ArrayList<>();
        private final List<String> completed = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
        private final List<Integer> progress = new ArrayList<>();
        private final List<String> stalled = new ArrayList<>();

        @Override
        public void onActive(QueueName queue, QueueJob job) {
            active.add(job.getId());
        }

        @Override
        public void onProgress(QueueName queue, QueueJob job, int percentage) {
            progress.add(percentage);
        }

        @Override
        public void onCompleted(QueueName queue, QueueJob job, Map<String, Object> result) {
            completed.add(job.getId());
        }

        @Override
        public void onFailed(QueueName queue, QueueJob job, Throwable error) {
            failed.add(job.getId());
        }

        @Override
        public void onStalled(QueueName queue, QueueJob job) {
            stalled.add(job.getId());
        }
    }
}
