package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.common.json.jackson.JacksonJsonParser;
import com.eyelevel.docpipeline.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.docpipeline.common.time.MutableClock;
import com.eyelevel.docpipeline.exception.DelayedRetryException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.model.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awspring.cloud.sqs.listener.MessageListenerContainer;
import io.awspring.cloud.sqs.listener.SqsHeaders;
import io.awspring.cloud.sqs.listener.Visibility;
import io.awspring.cloud.sqs.operations.SqsSendOptions;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqsJobQueueTest {

    private static final String QUEUE = "ocr-queue";

    @Mock
    private SqsTemplate sqsTemplate;
    @Mock
    private SqsAsyncClient sqsAsyncClient;
    @Mock
    private MessageListenerContainer<String> container;
    @Mock
    private Visibility visibility;
    @Mock(answer = Answers.RETURNS_SELF)
    private SqsSendOptions<Object> sendOptions;
    @Captor
    private ArgumentCaptor<Consumer<SqsSendOptions<Object>>> sendCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JacksonJsonSerializer jsonSerializer = new JacksonJsonSerializer(objectMapper);
    private final JacksonJsonParser jsonParser = new JacksonJsonParser(objectMapper);
    private final MutableClock clock = MutableClock.startingAt("2026-02-01T12:00:00Z");
    private final RecordingListener listener = new RecordingListener();
    private final List<QueueJob> handled = new ArrayList<>();

    private SqsJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = newQueue(QueueSettings.builder().backoffMs(2_000).stalledIntervalMs(60_000).build());
    }

    @Test
    void visibilityTimeoutFollowsTheStallInterval() {
        assertEquals(60, queue.getVisibilitySeconds());
        assertEquals(2, SqsJobQueue.visibilitySecondsFor(QueueSettings.builder().stalledIntervalMs(1_500).build()));
        assertEquals(SqsJobQueue.DEFAULT_VISIBILITY_SECONDS,
                SqsJobQueue.visibilitySecondsFor(QueueSettings.builder().build()));
        verify(container).setMessageListener(any());
    }

    @Test
    void addSendsTheJobAsADelayedMessage() {
        String jobId = queue.add("ocr-document", payload("doc-1"),
                JobOptions.builder().jobId("job-1").priority(2).delayMs(2_500L).build());

        assertEquals("job-1", jobId);
        List<Sent> sent = sent(1);
        assertEquals(3, sent.get(0).delaySeconds());
        QueueMessage message = sent.get(0).message();
        assertEquals("job-1", message.getJobId());
        assertEquals("ocr-document", message.getJobKind());
        assertEquals("doc-1", message.getPayload().getDocumentId());
        assertEquals(3, message.getAttempts());
        assertEquals(0, message.getAttemptsMade());
        assertEquals(0, message.getNotBefore());
        verify(sendOptions).queue(QUEUE);
        assertThat(queue.getDelayed()).extracting(QueueJob::getId).containsExactly("job-1");
        assertThat(queue.getWaiting()).isEmpty();
    }

    @Test
    void addingAJobThatWasNotDeliveredYetIsIgnored() {
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").build());

        verify(sqsTemplate, times(1)).send(ArgumentMatchers.<Consumer<SqsSendOptions<Object>>>any());
        assertThat(queue.getWaiting()).extracting(QueueJob::getId).containsExactly("job-1");
    }

    @Test
    void delayBeyondTheSqsMaximumIsCarriedInTheMessage() {
        queue.add("ocr-document", payload("doc-1"),
                JobOptions.builder().jobId("job-1").attemptsMade(1).delayMs(3_600_000L).build());

        Sent sent = sent(1).get(0);
        assertEquals(SqsJobQueue.MAX_DELAY_SECONDS, sent.delaySeconds());
        assertEquals(clock.millis() + 3_600_000L, sent.message().getNotBefore());
        assertEquals(1, sent.message().getAttemptsMade());
    }

    @Test
    void messageDeliveredBeforeItsTimeIsSentBackWithTheRemainingDelay() {
        queue.setHandler(recording());
        QueueMessage early = message("job-1", 0).toBuilder().notBefore(clock.millis() + 1_000_000L).build();

        queue.onMessage(delivery(early, 1));

        assertThat(handled).isEmpty();
        Sent sent = sent(1).get(0);
        assertEquals(SqsJobQueue.MAX_DELAY_SECONDS, sent.delaySeconds());
        assertEquals(early.getNotBefore(), sent.message().getNotBefore());
    }

    @Test
    void settingTheHandlerStartsListening() {
        queue.setHandler(recording());

        verify(container).start();
    }

    @Test
    void successfulRunCompletesTheJob() {
        queue.setHandler(recording());

        queue.onMessage(delivery(message("job-1", 0), 1));

        assertThat(handled).extracting(QueueJob::getId).containsExactly("job-1");
        assertEquals(QueueJobState.ACTIVE, handled.get(0).getState());
        assertThat(listener.active).containsExactly("job-1");
        assertThat(listener.completed).containsExactly("job-1");
        assertTrue(queue.getJob("job-1").isEmpty());
        verify(sqsTemplate, never()).send(ArgumentMatchers.<Consumer<SqsSendOptions<Object>>>any());
    }

    @Test
    void failedAttemptIsResentWithExponentialBackoff() {
        queue.setHandler((job, progress) -> {
            throw new IllegalStateException("Textract throttled");
        });

        queue.onMessage(delivery(message("job-1", 0), 1));
        queue.onMessage(delivery(message("job-1", 1), 1));

        List<Sent> sent = sent(2);
        assertEquals(1, sent.get(0).message().getAttemptsMade());
        assertEquals(2, sent.get(0).delaySeconds());
        assertEquals(2, sent.get(1).message().getAttemptsMade());
        assertEquals(4, sent.get(1).delaySeconds());
        assertThat(listener.failed).isEmpty();
        assertThat(queue.getDelayed()).extracting(QueueJob::getAttemptsMade).containsExactly(2);
    }

    @Test
    void lastAttemptFailsTheJob() {
        queue.setHandler((job, progress) -> {
            throw new IllegalStateException("still broken");
        });

        queue.onMessage(delivery(message("job-1", 2), 1));

        assertThat(listener.failed).containsExactly("job-1");
        assertEquals("still broken", listener.lastFailure.getMessage());
        verify(sqsTemplate, never()).send(ArgumentMatchers.<Consumer<SqsSendOptions<Object>>>any());
    }

    @Test
    void unrecoverableFailureIsNotRetried() {
        queue.setHandler((job, progress) -> {
            throw new UnrecoverableJobException("password protected", null);
        });

        queue.onMessage(delivery(message("job-1", 0), 1));

        assertThat(listener.failed).containsExactly("job-1");
        verify(sqsTemplate, never()).send(ArgumentMatchers.<Consumer<SqsSendOptions<Object>>>any());
    }

    @Test
    void delayedRetryDoesNotUseAnAttempt() {
        queue.setHandler((job, progress) -> {
            throw new DelayedRetryException("rate limited", 30_000, null);
        });

        queue.onMessage(delivery(message("job-1", 1), 1));

        Sent sent = sent(1).get(0);
        assertEquals(30, sent.delaySeconds());
        assertEquals(1, sent.message().getAttemptsMade());
        assertThat(listener.failed).isEmpty();
    }

    @Test
    void failedResendIsThrownSoTheMessageIsDeliveredAgain() {
        queue.setHandler((job, progress) -> {
            throw new IllegalStateException("boom");
        });
        doThrow(new IllegalStateException("SQS unavailable"))
                .when(sqsTemplate).send(ArgumentMatchers.<Consumer<SqsSendOptions<Object>>>any());

        Message<String> delivery = delivery(message("job-1", 0), 1);

        assertThrows(ProcessingException.class, () -> queue.onMessage(delivery));
        assertThat(listener.failed).isEmpty();
    }

    @Test
    void redeliveredMessageIsReportedAsStalledAndRunAgain() {
        queue.setHandler(recording());

        queue.onMessage(delivery(message("job-1", 0), 2));

        assertThat(listener.stalled).containsExactly("job-1");
        assertThat(handled).extracting(QueueJob::getId).containsExactly("job-1");
        assertThat(listener.completed).containsExactly("job-1");
    }

    @Test
    void messageThatStalledTooOftenFailsWithoutRunning() {
        queue.setHandler(recording());

        queue.onMessage(delivery(message("job-1", 0), 3));

        assertThat(handled).isEmpty();
        assertThat(listener.stalled).containsExactly("job-1");
        assertThat(listener.failed).containsExactly("job-1");
        assertInstanceOf(JobStateException.class, listener.lastFailure);
        assertThat(listener.lastFailure.getMessage()).endsWith(SqsJobQueue.STALLED_REASON);
    }

    @Test
    void unreadableMessageIsDropped() {
        queue.setHandler(recording());

        queue.onMessage(MessageBuilder.withPayload("not json").build());

        assertThat(handled).isEmpty();
        assertThat(listener.failed).isEmpty();
    }

    @Test
    void removedJobIsDroppedWhenDelivered() {
        queue.setHandler(recording());
        queue.add("ocr-document", payload("doc-1"), JobOptions.builder().jobId("job-1").delayMs(5_000L).build());

        assertTrue(queue.remove("job-1"));
        assertFalse(queue.remove("job-1"));
        queue.onMessage(delivery(message("job-1", 0), 1));

        assertThat(handled).isEmpty();
        assertTrue(queue.getDelayed().isEmpty());
    }

    @Test
    void runningJobCannotBeRemoved() {
        queue.setHandler((job, progress) -> {
            assertThrows(JobStateException.class, () -> queue.remove(job.getId()));
            return Map.of();
        });

        queue.onMessage(delivery(message("job-1", 0), 1));

        assertThat(listener.completed).containsExactly("job-1");
    }

    @Test
    void pauseStopsTheContainerAndResumeStartsIt() {
        queue.setHandler(recording());

        queue.pause();
        queue.resume();

        verify(container).stop();
        verify(container, times(2)).start();
        assertFalse(queue.isPaused());
    }

    @Test
    void pausedQueueDoesNotStartWhenTheHandlerIsSet() {
        queue.pause();
        queue.setHandler(recording());

        assertTrue(queue.isPaused());
        verify(container, never()).start();
    }

    @Test
    void heartbeatExtendsVisibilityOnceHalfOfItHasPassed() {
        when(visibility.changeToAsync(anyInt())).thenReturn(CompletableFuture.completedFuture(null));
        queue.setHandler((job, progress) -> {
            clock.advance(Duration.ofSeconds(10));
            progress.heartbeat();
            clock.advance(Duration.ofSeconds(25));
            progress.heartbeat();
            progress.heartbeat();
            clock.advance(Duration.ofSeconds(31));
            progress.report(40);
            return Map.of();
        });

        queue.onMessage(delivery(message("job-1", 0), 1));

        verify(visibility, times(2)).changeToAsync(60);
        assertThat(listener.progress).containsExactly(40);
    }

    @Test
    void countsComeFromQueueAttributes() {
        when(sqsAsyncClient.getQueueUrl(any(GetQueueUrlRequest.class))).thenReturn(CompletableFuture.completedFuture(
                GetQueueUrlResponse.builder().queueUrl("https://sqs.us-east-1.amazonaws.com/123/ocr-queue").build()));
        when(sqsAsyncClient.getQueueAttributes(any(GetQueueAttributesRequest.class))).thenReturn(
                CompletableFuture.completedFuture(GetQueueAttributesResponse.builder().attributes(Map.of(
                        QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES, "7",
                        QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE, "2",
                        QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED, "4")).build()));
        queue.setHandler(recording());
        queue.onMessage(delivery(message("job-1", 0), 1));

        JobCounts first = queue.getCounts();
        JobCounts second = queue.getCounts();

        assertEquals(new JobCounts(7, 2, 1, 0, 4), first);
        assertEquals(first, second);
        verify(sqsAsyncClient, times(1)).getQueueUrl(any(GetQueueUrlRequest.class));
    }

    @Test
    void cleanHasNothingToRemove() {
        assertThat(queue.clean(0, 100, QueueJobState.COMPLETED)).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> queue.clean(0, 100, QueueJobState.WAITING));
        verifyNoInteractions(sqsAsyncClient);
    }

    private SqsJobQueue newQueue(QueueSettings settings) {
        SqsJobQueue sqsQueue = new SqsJobQueue(QueueName.OCR, QUEUE, settings, sqsTemplate, sqsAsyncClient,
                container, jsonSerializer, jsonParser, clock);
        sqsQueue.addListener(listener);
        return sqsQueue;
    }

    private JobHandler recording() {
        return (job, progress) -> {
            handled.add(job);
            return Map.of("ok", true);
        };
    }

    private List<Sent> sent(int count) {
        verify(sqsTemplate, times(count)).send(sendCaptor.capture());
        sendCaptor.getAllValues().forEach(send -> send.accept(sendOptions));
        ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
        ArgumentCaptor<Integer> delays = ArgumentCaptor.forClass(Integer.class);
        verify(sendOptions, times(count)).payload(payloads.capture());
        verify(sendOptions, times(count)).delaySeconds(delays.capture());
        List<Sent> sent = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sent.add(new Sent(jsonParser.parseObject((String) payloads.getAllValues().get(i), QueueMessage.class),
                    delays.getAllValues().get(i)));
        }
        return sent;
    }

    private QueueMessage message(String jobId, int attemptsMade) {
        return QueueMessage.builder()
                .jobId(jobId)
                .jobKind("ocr-document")
                .payload(payload("doc-1"))
                .attempts(3)
                .attemptsMade(attemptsMade)
                .timestamp(clock.millis())
                .build();
    }

    private Message<String> delivery(QueueMessage message, int receiveCount) {
        return MessageBuilder.withPayload(jsonSerializer.serialize(message))
                .setHeader(SqsHeaders.MessageSystemAttributes.SQS_APPROXIMATE_RECEIVE_COUNT,
                           String.valueOf(receiveCount))
                .setHeader(SqsHeaders.SQS_VISIBILITY_TIMEOUT_HEADER, visibility)
                .build();
    }

    private static JobPayload payload(String documentId) {
        return JobPayload.builder()
                .documentId(documentId)
                .organizationId("org-1")
                .s3Key("org-1/" + documentId + ".pdf")
                .jobType(JobType.OCR)
                .build();
    }

    private record Sent(QueueMessage message, int delaySeconds) {
    }

    private static class RecordingListener implements QueueEventListener {
        final List<String> active = new ArrayList<>();
        final List<String> completed = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        final List<String> stalled = new ArrayList<>();
        final List<Integer> progress = new ArrayList<>();
        Throwable lastFailure;

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
            lastFailure = error;
        }

        @Override
        public void onStalled(QueueName queue, QueueJob job) {
            stalled.add(job.getId());
        }
    }
}
