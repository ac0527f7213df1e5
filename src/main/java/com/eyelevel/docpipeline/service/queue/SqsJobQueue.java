package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.common.json.JsonSerializer;
import com.eyelevel.docpipeline.exception.DelayedRetryException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import io.awspring.cloud.sqs.listener.MessageListenerContainer;
import io.awspring.cloud.sqs.listener.SqsHeaders;
import io.awspring.cloud.sqs.listener.Visibility;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link JobQueue} on an SQS queue.
 * <p>
 * Each queue owns one listener container whose concurrency is the queue's. A job is one message. A failed attempt
 * is re-sent as a new message delayed by the exponential backoff and carrying the attempts used; the received
 * message is acknowledged once the outcome is settled. When the re-send itself fails the listener throws, the
 * message is left unacknowledged and SQS delivers it again after its visibility timeout.
 * <p>
 * The visibility timeout is the stall interval. Progress and heartbeats extend it; a message that comes back
 * before it was acknowledged belongs to a stalled run and is reported as such, and fails once it has stalled more
 * than {@code maxStalledCount} times.
 * <p>
 * SQS does not list its messages, keep finished ones or order by priority. Waiting and delayed views cover only
 * messages this instance sent and has not seen delivered yet, {@link #remove(String)} marks such a message to be
 * dropped on delivery, finished jobs are only counted, and priority is ignored.
 */
@Slf4j
public class SqsJobQueue implements JobQueue {

    static final int MAX_DELAY_SECONDS = 900;
    static final int DEFAULT_VISIBILITY_SECONDS = 300;
    static final String STALLED_REASON = "job stalled more than allowable limit";

    @Getter
    private final QueueName name;
    private final String queue;
    private final QueueSettings settings;
    private final SqsTemplate sqsTemplate;
    private final SqsAsyncClient sqsAsyncClient;
    private final MessageListenerContainer<String> container;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final Clock clock;
    private final WindowRateLimiter rateLimiter;
    @Getter
    private final int visibilitySeconds;

    private final Map<String, QueueJob> inFlight = new ConcurrentHashMap<>();
    private final Map<String, QueueJob> undelivered = new ConcurrentHashMap<>();
    private final Set<String> removed = ConcurrentHashMap.newKeySet();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

    private volatile JobHandler handler;
    private volatile boolean paused;
    private volatile String queueUrl;

    /**
     * @param queue SQS queue name or URL.
     */
    public SqsJobQueue(QueueName name, String queue, QueueSettings settings, SqsTemplate sqsTemplate,
                       SqsAsyncClient sqsAsyncClient, MessageListenerContainer<String> container,
                       JsonSerializer jsonSerializer, JsonParser jsonParser, Clock clock) {
        this.name = name;
        this.queue = queue;
        this.settings = settings;
        this.sqsTemplate = sqsTemplate;
        this.sqsAsyncClient = sqsAsyncClient;
        this.container = container;
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
        this.clock = clock;
        this.rateLimiter = settings.getRateLimitMax() > 0
                ? new WindowRateLimiter(settings.getRateLimitMax(), settings.getRateLimitDurationMs())
                : null;
        this.visibilitySeconds = visibilitySecondsFor(settings);
        container.setMessageListener(this::onMessage);
    }

    /**
     * Visibility timeout that makes an unacknowledged message reappear after one stall interval.
     */
    public static int visibilitySecondsFor(QueueSettings settings) {
        return settings.getStalledIntervalMs() > 0
                ? (int) Math.max(1, (settings.getStalledIntervalMs() + 999) / 1000)
                : DEFAULT_VISIBILITY_SECONDS;
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    @Override
    public void setHandler(JobHandler handler) {
        this.handler = handler;
        if (!paused && !container.isRunning()) {
            container.start();
            log.info("[{}] Listening on SQS queue '{}'.", name.getValue(), queue);
        }
    }

    @Override
    public void addListener(QueueEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public String add(String jobKind, JobPayload payload, JobOptions options) {
        String jobId = Optional.ofNullable(options.getJobId()).orElseGet(() -> UUID.randomUUID().toString());
        if (inFlight.containsKey(jobId) || undelivered.containsKey(jobId)) {
            log.debug("[{}] Job {} already queued; ignoring add.", name.getValue(), jobId);
            return jobId;
        }
        removed.remove(jobId);
        QueueMessage message = QueueMessage.builder()
                .jobId(jobId)
                .jobKind(jobKind)
                .payload(payload)
                .priority(Optional.ofNullable(options.getPriority()).orElse(0))
                .attempts(Math.max(1, Optional.ofNullable(options.getAttempts()).orElse(settings.getDefaultAttempts())))
                .attemptsMade(Math.max(0, Optional.ofNullable(options.getAttemptsMade()).orElse(0)))
                .timestamp(clock.millis())
                .build();
        send(message, Optional.ofNullable(options.getDelayMs()).orElse(0L));
        return jobId;
    }

    @Override
    public Optional<QueueJob> getJob(String jobId) {
        return Optional.ofNullable(inFlight.get(jobId)).or(() -> Optional.ofNullable(undelivered.get(jobId)));
    }

    @Override
    public List<QueueJob> getWaiting() {
        return undeliveredIn(QueueJobState.WAITING);
    }

    @Override
    public List<QueueJob> getDelayed() {
        return undeliveredIn(QueueJobState.DELAYED);
    }

    @Override
    public boolean remove(String jobId) {
        if (inFlight.containsKey(jobId)) {
            throw new JobStateException("Job " + jobId + " is being processed and cannot be removed");
        }
        if (undelivered.remove(jobId) == null) {
            return false;
        }
        removed.add(jobId);
        return true;
    }

    @Override
    public void pause() {
        paused = true;
        container.stop();
        log.info("[{}] Queue paused.", name.getValue());
    }

    @Override
    public void resume() {
        paused = false;
        if (handler != null && !container.isRunning()) {
            container.start();
        }
        log.info("[{}] Queue resumed.", name.getValue());
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    /**
     * SQS keeps no finished messages, so there is nothing to clean.
     */
    @Override
    public List<String> clean(long graceMs, int limit, QueueJobState state) {
        if (!state.isFinished()) {
            throw new IllegalArgumentException("Only completed or failed jobs can be cleaned, got " + state);
        }
        return List.of();
    }

    /**
     * Waiting, active and delayed counts are the approximate numbers SQS reports for the queue; completed and
     * failed count the outcomes seen by this instance.
     */
    @Override
    public JobCounts getCounts() {
        try {
            Map<QueueAttributeName, String> attributes = sqsAsyncClient.getQueueAttributes(
                    GetQueueAttributesRequest.builder()
                            .queueUrl(resolveQueueUrl())
                            .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES,
                                            QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE,
                                            QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED)
                            .build()).join().attributes();
            return new JobCounts(count(attributes, QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES),
                    count(attributes, QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE),
                    completed.get(), failed.get(),
                    count(attributes, QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED));
        } catch (CompletionException e) {
            throw new ProcessingException("Failed to read attributes of SQS queue " + queue, e.getCause());
        }
    }

    @Override
    public void close() {
        if (container.isRunning()) {
            container.stop();
        }
    }

    void onMessage(Message<String> message) {
        QueueMessage job;
        try {
            job = jsonParser.parseObject(message.getPayload(), QueueMessage.class);
        } catch (JsonParsingException e) {
            log.error("[FATAL] [{}] SQS message is not a job message and will be dropped. Payload: {}",
                      name.getValue(), message.getPayload(), e);
            return;
        }
        if (job.getJobId() == null || job.getPayload() == null) {
            log.error("[FATAL] [{}] SQS message is missing 'jobId' or 'payload' and will be dropped. Payload: {}",
                      name.getValue(), message.getPayload());
            return;
        }
        undelivered.remove(job.getJobId());
        if (removed.remove(job.getJobId())) {
            log.info("[{}] Job {} was removed from the queue. Dropping its message.", name.getValue(), job.getJobId());
            return;
        }

        long now = clock.millis();
        if (job.getNotBefore() > now) {
            send(job, job.getNotBefore() - now);
            return;
        }
        if (rateLimiter != null && !rateLimiter.tryAcquire(now)) {
            send(job, rateLimiter.nextAvailableAt(now) - now);
            return;
        }

        int stalls = receiveCountOf(message) - 1;
        if (stalls > 0) {
            QueueJob snapshot = snapshot(job, QueueJobState.WAITING, job.getAttemptsMade(), null);
            log.warn("[{}] Job {} was delivered again before it was acknowledged; its previous run stalled.",
                     name.getValue(), job.getJobId());
            notifyListeners(listener -> listener.onStalled(name, snapshot));
            if (stalls > settings.getMaxStalledCount()) {
                fail(job, job.getAttemptsMade() + 1, new JobStateException("Job " + job.getJobId() + " " + STALLED_REASON));
                return;
            }
        }
        run(job, message.getHeaders().get(SqsHeaders.SQS_VISIBILITY_TIMEOUT_HEADER, Visibility.class));
    }

    private void run(QueueMessage job, Visibility visibility) {
        QueueJob active = snapshot(job, QueueJobState.ACTIVE, job.getAttemptsMade(), null);
        inFlight.put(job.getJobId(), active);
        notifyListeners(listener -> listener.onActive(name, active));
        try {
            Map<String, Object> result = handler.handle(active, new VisibilityHeartbeat(job, visibility));
            completed.incrementAndGet();
            QueueJob finished = snapshot(job, QueueJobState.COMPLETED, job.getAttemptsMade(), null);
            notifyListeners(listener -> listener.onCompleted(name, finished, result));
        } catch (DelayedRetryException e) {
            log.info("[{}] Job {} re-sent in {}ms without consuming an attempt.", name.getValue(), job.getJobId(),
                     e.getRetryAfterMs());
            send(job, e.getRetryAfterMs());
        } catch (Exception e) {
            int attemptsMade = job.getAttemptsMade() + 1;
            boolean retryable = !(e instanceof UnrecoverableJobException);
            if (retryable && attemptsMade < job.getAttempts()) {
                long backoff = settings.getBackoffMs() * (1L << Math.min(attemptsMade - 1, 20));
                log.warn("[{}] Job {} attempt {}/{} failed: {}. Retrying in {}ms.", name.getValue(), job.getJobId(),
                         attemptsMade, job.getAttempts(), e.getMessage(), backoff);
                send(job.toBuilder().attemptsMade(attemptsMade).build(), backoff);
            } else {
                fail(job, attemptsMade, e);
            }
        } finally {
            inFlight.remove(job.getJobId());
        }
    }

    private void fail(QueueMessage job, int attemptsMade, Exception error) {
        failed.incrementAndGet();
        QueueJob snapshot = snapshot(job, QueueJobState.FAILED, attemptsMade, error.getMessage());
        notifyListeners(listener -> listener.onFailed(name, snapshot, error));
    }

    /**
     * Sends the job as a new message. Delays beyond the SQS maximum are carried in the message and finished by
     * re-sending it on delivery.
     *
     * @throws ProcessingException if SQS does not accept the message.
     */
    private void send(QueueMessage job, long delayMs) {
        long now = clock.millis();
        long delay = Math.max(0, delayMs);
        int delaySeconds = (int) Math.min(MAX_DELAY_SECONDS, (delay + 999) / 1000);
        QueueMessage message = job.toBuilder()
                .notBefore(delay > MAX_DELAY_SECONDS * 1000L ? now + delay : 0)
                .build();
        String body = jsonSerializer.serialize(message);
        try {
            sqsTemplate.send(to -> to.queue(queue).payload(body).delaySeconds(delaySeconds));
        } catch (RuntimeException e) {
            log.error("[{}] Failed to send job {} to SQS queue '{}'.", name.getValue(), job.getJobId(), queue, e);
            throw new ProcessingException("Failed to send job " + job.getJobId() + " to " + queue, e);
        }
        QueueJobState state = delay > 0 ? QueueJobState.DELAYED : QueueJobState.WAITING;
        undelivered.put(job.getJobId(), snapshot(message, state, message.getAttemptsMade(), null));
    }

    private String resolveQueueUrl() {
        if (queueUrl == null) {
            queueUrl = queue.startsWith("https://") || queue.startsWith("http://")
                    ? queue
                    : sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queue).build())
                            .join().queueUrl();
        }
        return queueUrl;
    }

    private List<QueueJob> undeliveredIn(QueueJobState state) {
        return undelivered.values().stream()
                .filter(job -> job.getState() == state)
                .sorted(Comparator.comparingLong(QueueJob::getTimestamp))
                .toList();
    }

    private QueueJob snapshot(QueueMessage job, QueueJobState state, int attemptsMade, String failedReason) {
        return QueueJob.builder()
                .id(job.getJobId())
                .name(job.getJobKind())
                .payload(job.getPayload())
                .priority(job.getPriority())
                .attempts(job.getAttempts())
                .attemptsMade(attemptsMade)
                .state(state)
                .failedReason(failedReason)
                .timestamp(job.getTimestamp())
                .build();
    }

    private void notifyListeners(Consumer<QueueEventListener> event) {
        for (QueueEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("[{}] Queue listener {} failed.", name.getValue(), listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static int receiveCountOf(Message<String> message) {
        Object count = message.getHeaders().get(SqsHeaders.MessageSystemAttributes.SQS_APPROXIMATE_RECEIVE_COUNT);
        return count == null ? 1 : Integer.parseInt(count.toString());
    }

    private static long count(Map<QueueAttributeName, String> attributes, QueueAttributeName attribute) {
        return Long.parseLong(attributes.getOrDefault(attribute, "0"));
    }

    /**
     * Progress channel of one delivery. Progress goes to the listeners; progress and heartbeats both push the
     * message's visibility timeout out again once half of it has passed.
     */
    private final class VisibilityHeartbeat implements JobHandler.ProgressReporter {

        private final QueueMessage job;
        private final Visibility visibility;
        private final AtomicLong extendedAt = new AtomicLong(clock.millis());

        private VisibilityHeartbeat(QueueMessage job, Visibility visibility) {
            this.job = job;
            this.visibility = visibility;
        }

        @Override
        public void report(int percentage) {
            int bounded = Math.max(0, Math.min(100, percentage));
            QueueJob snapshot = inFlight.computeIfPresent(job.getJobId(), (id, current) -> current.toBuilder()
                    .progress(bounded)
                    .build());
            heartbeat();
            if (snapshot != null) {
                notifyListeners(listener -> listener.onProgress(name, snapshot, bounded));
            }
        }

        @Override
        public void heartbeat() {
            long now = clock.millis();
            long last = extendedAt.get();
            if (visibility == null || now - last < visibilitySeconds * 500L || !extendedAt.compareAndSet(last, now)) {
                return;
            }
            visibility.changeToAsync(visibilitySeconds).exceptionally(ex -> {
                log.warn("[{}] Could not extend visibility of job {}: {}", name.getValue(), job.getJobId(),
                         ex.getMessage());
                return null;
            });
        }
    }
}
