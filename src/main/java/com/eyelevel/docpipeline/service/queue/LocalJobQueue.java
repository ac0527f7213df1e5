package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.exception.DelayedRetryException;
import com.eyelevel.docpipeline.exception.JobStateException;
import com.eyelevel.docpipeline.exception.UnrecoverableJobException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process {@link JobQueue}.
 * <p>
 * Waiting jobs are ordered by priority (lower first) and insertion order. Up to {@code concurrency} jobs run at
 * once on the worker executor, and dispatch is additionally throttled by an optional sliding-window rate limit.
 * A failed attempt is re-delivered after an exponential backoff until its attempts are used up, except for
 * {@link UnrecoverableJobException}, which fails at once, and {@link DelayedRetryException}, which is re-delivered
 * after its own delay without counting the attempt.
 * <p>
 * An active job that sends neither progress nor a heartbeat for {@code stalledIntervalMs} is stalled: it gives up
 * its concurrency slot and goes back to waiting without counting an attempt, or fails once it has stalled more than
 * {@code maxStalledCount} times. Every dispatch opens a new generation of the job, so the late outcome of a stalled
 * run is ignored.
 * <p>
 * All state is guarded by a single monitor. Handlers and listeners always run outside it.
 */
@Slf4j
public class LocalJobQueue implements JobQueue {

    static final String STALLED_REASON = "job stalled more than allowable limit";

    private static final Comparator<Entry> DISPATCH_ORDER =
            Comparator.comparingInt((Entry e) -> e.priority).thenComparingLong(e -> e.sequence);

    @Getter
    private final QueueName name;
    private final QueueSettings settings;
    private final TaskExecutor workerExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final WindowRateLimiter rateLimiter;

    private final Object lock = new Object();
    private final Map<String, Entry> entries = new HashMap<>();
    private final PriorityQueue<Entry> waiting = new PriorityQueue<>(DISPATCH_ORDER);
    private final Deque<Entry> completed = new ArrayDeque<>();
    private final Deque<Entry> failed = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

    private volatile JobHandler handler;
    private boolean paused;
    private int activeCount;
    private ScheduledFuture<?> rateLimitWakeUp;
    private ScheduledFuture<?> stallWatchdog;

    public LocalJobQueue(QueueName name, QueueSettings settings, TaskExecutor workerExecutor,
                         TaskScheduler scheduler, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.workerExecutor = workerExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.rateLimiter = settings.getRateLimitMax() > 0
                ? new WindowRateLimiter(settings.getRateLimitMax(), settings.getRateLimitDurationMs())
                : null;
        if (settings.getStalledIntervalMs() > 0) {
            this.stallWatchdog = scheduler.scheduleWithFixedDelay(this::checkStalled,
                    Duration.ofMillis(settings.getStalledIntervalMs()));
        }
    }

    @Override
    public void setHandler(JobHandler handler) {
        this.handler = handler;
        dispatch();
    }

    @Override
    public void addListener(QueueEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public String add(String jobKind, JobPayload payload, JobOptions options) {
        String jobId = Optional.ofNullable(options.getJobId()).orElseGet(() -> UUID.randomUUID().toString());
        synchronized (lock) {
            Entry existing = entries.get(jobId);
            if (existing != null && !existing.state.isFinished()) {
                log.debug("[{}] Job {} already queued in state {}; ignoring add.", name.getValue(), jobId, existing.state);
                return jobId;
            }
            if (existing != null) {
                discard(existing);
            }
            Entry entry = new Entry(jobId, jobKind, payload, options, settings.getDefaultAttempts(),
                    sequence.incrementAndGet(), now());
            entries.put(jobId, entry);
            long delayMs = Optional.ofNullable(options.getDelayMs()).orElse(0L);
            if (delayMs > 0) {
                delay(entry, delayMs);
            } else {
                entry.state = QueueJobState.WAITING;
                waiting.add(entry);
            }
        }
        dispatch();
        return jobId;
    }

    @Override
    public Optional<QueueJob> getJob(String jobId) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(jobId)).map(Entry::snapshot);
        }
    }

    @Override
    public List<QueueJob> getWaiting() {
        synchronized (lock) {
            return waiting.stream().sorted(DISPATCH_ORDER).map(Entry::snapshot).toList();
        }
    }

    @Override
    public List<QueueJob> getDelayed() {
        return snapshotsIn(QueueJobState.DELAYED);
    }

    @Override
    public boolean remove(String jobId) {
        synchronized (lock) {
            Entry entry = entries.get(jobId);
            if (entry == null) {
                return false;
            }
            if (entry.state == QueueJobState.ACTIVE) {
                throw new JobStateException("Job " + jobId + " is being processed and cannot be removed");
            }
            discard(entry);
            return true;
        }
    }

    @Override
    public void pause() {
        synchronized (lock) {
            paused = true;
        }
        log.info("[{}] Queue paused.", name.getValue());
    }

    @Override
    public void resume() {
        synchronized (lock) {
            paused = false;
        }
        log.info("[{}] Queue resumed.", name.getValue());
        dispatch();
    }

    @Override
    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    @Override
    public List<String> clean(long graceMs, int limit, QueueJobState state) {
        if (!state.isFinished()) {
            throw new IllegalArgumentException("Only completed or failed jobs can be cleaned, got " + state);
        }
        long cutoff = now() - graceMs;
        List<String> removed = new ArrayList<>();
        synchronized (lock) {
            Deque<Entry> finished = state == QueueJobState.COMPLETED ? completed : failed;
            Iterator<Entry> it = finished.iterator();
            while (it.hasNext() && (limit <= 0 || removed.size() < limit)) {
                Entry entry = it.next();
                if (entry.finishedOn != null && entry.finishedOn < cutoff) {
                    it.remove();
                    entries.remove(entry.id);
                    removed.add(entry.id);
                }
            }
        }
        return removed;
    }

    @Override
    public JobCounts getCounts() {
        synchronized (lock) {
            return new JobCounts(waiting.size(), activeCount, completed.size(), failed.size(),
                    countIn(QueueJobState.DELAYED));
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            cancel(stallWatchdog);
            cancel(rateLimitWakeUp);
            entries.values().forEach(entry -> cancel(entry.timer));
        }
        if (workerExecutor instanceof ExecutorConfigurationSupport pool) {
            pool.shutdown();
        }
    }

    private void dispatch() {
        Map<Entry, Integer> toStart = new LinkedHashMap<>();
        synchronized (lock) {
            if (handler == null || paused) {
                return;
            }
            while (activeCount < settings.getConcurrency() && !waiting.isEmpty()) {
                long nowMs = now();
                if (rateLimiter != null && !rateLimiter.tryAcquire(nowMs)) {
                    scheduleRateLimitWakeUp(rateLimiter.nextAvailableAt(nowMs));
                    break;
                }
                Entry entry = waiting.poll();
                entry.state = QueueJobState.ACTIVE;
                entry.processedOn = nowMs;
                entry.lastHeartbeat = nowMs;
                activeCount++;
                toStart.put(entry, ++entry.generation);
            }
        }
        toStart.forEach((entry, generation) -> workerExecutor.execute(() -> run(entry, generation)));
    }

    private void run(Entry entry, int generation) {
        QueueJob started = snapshotOf(entry);
        notifyListeners(listener -> listener.onActive(name, started));
        try {
            Map<String, Object> result = handler.handle(started, new JobHandler.ProgressReporter() {
                @Override
                public void report(int percentage) {
                    reportProgress(entry, generation, percentage);
                }

                @Override
                public void heartbeat() {
                    touch(entry, generation);
                }
            });
            onSuccess(entry, generation, result);
        } catch (Exception e) {
            onFailure(entry, generation, e);
        } finally {
            dispatch();
        }
    }

    private void reportProgress(Entry entry, int generation, int percentage) {
        int bounded = Math.max(0, Math.min(100, percentage));
        QueueJob snapshot;
        synchronized (lock) {
            if (!isCurrentRun(entry, generation)) {
                return;
            }
            entry.progress = bounded;
            entry.lastHeartbeat = now();
            snapshot = entry.snapshot();
        }
        notifyListeners(listener -> listener.onProgress(name, snapshot, bounded));
    }

    private void touch(Entry entry, int generation) {
        synchronized (lock) {
            if (isCurrentRun(entry, generation)) {
                entry.lastHeartbeat = now();
            }
        }
    }

    private boolean isCurrentRun(Entry entry, int generation) {
        return entry.state == QueueJobState.ACTIVE && entry.generation == generation && entries.get(entry.id) == entry;
    }

    private void onSuccess(Entry entry, int generation, Map<String, Object> result) {
        QueueJob snapshot;
        synchronized (lock) {
            if (!isCurrentRun(entry, generation)) {
                log.debug("[{}] Ignoring completion of a superseded run of job {}.", name.getValue(), entry.id);
                return;
            }
            activeCount--;
            entry.state = QueueJobState.COMPLETED;
            entry.returnValue = result;
            entry.finishedOn = now();
            snapshot = entry.snapshot();
            if (entry.options.isRemoveOnComplete()) {
                entries.remove(entry.id);
            } else {
                completed.addLast(entry);
                enforceRetention(completed, settings.getCompletedRetentionCount(), settings.getCompletedRetentionMs());
            }
        }
        notifyListeners(listener -> listener.onCompleted(name, snapshot, result));
    }

    private void onFailure(Entry entry, int generation, Exception error) {
        QueueJob finalFailure = null;
        synchronized (lock) {
            if (!isCurrentRun(entry, generation)) {
                log.debug("[{}] Ignoring failure of a superseded run of job {}: {}", name.getValue(), entry.id,
                          error.getMessage());
                return;
            }
            activeCount--;
            entry.failedReason = error.getMessage();
            if (error instanceof DelayedRetryException delayedRetry) {
                log.info("[{}] Job {} re-delivered in {}ms without consuming an attempt.", name.getValue(), entry.id,
                         delayedRetry.getRetryAfterMs());
                delay(entry, delayedRetry.getRetryAfterMs());
            } else {
                entry.attemptsMade++;
                boolean retryable = !(error instanceof UnrecoverableJobException);
                if (retryable && entry.attemptsMade < entry.attempts) {
                    long backoff = settings.getBackoffMs() * (1L << Math.min(entry.attemptsMade - 1, 20));
                    log.warn("[{}] Job {} attempt {}/{} failed: {}. Retrying in {}ms.", name.getValue(), entry.id,
                             entry.attemptsMade, entry.attempts, error.getMessage(), backoff);
                    delay(entry, backoff);
                } else {
                    finalFailure = fail(entry);
                }
            }
        }
        if (finalFailure != null) {
            QueueJob snapshot = finalFailure;
            notifyListeners(listener -> listener.onFailed(name, snapshot, error));
        }
    }

    private QueueJob fail(Entry entry) {
        entry.state = QueueJobState.FAILED;
        entry.finishedOn = now();
        QueueJob snapshot = entry.snapshot();
        if (entry.options.isRemoveOnFail()) {
            entries.remove(entry.id);
        } else {
            failed.addLast(entry);
            enforceRetention(failed, settings.getFailedRetentionCount(), settings.getFailedRetentionMs());
        }
        return snapshot;
    }

    private void delay(Entry entry, long delayMs) {
        entry.state = QueueJobState.DELAYED;
        entry.timer = scheduler.schedule(() -> promote(entry), Instant.ofEpochMilli(now() + delayMs));
    }

    private void promote(Entry entry) {
        synchronized (lock) {
            if (entries.get(entry.id) != entry || entry.state != QueueJobState.DELAYED) {
                return;
            }
            entry.timer = null;
            entry.state = QueueJobState.WAITING;
            waiting.add(entry);
        }
        dispatch();
    }

    private void scheduleRateLimitWakeUp(long atMs) {
        if (rateLimitWakeUp != null && !rateLimitWakeUp.isDone()) {
            return;
        }
        rateLimitWakeUp = scheduler.schedule(this::dispatch, Instant.ofEpochMilli(atMs));
    }

    void checkStalled() {
        long threshold = now() - settings.getStalledIntervalMs();
        List<QueueJob> stalled = new ArrayList<>();
        List<QueueJob> exhausted = new ArrayList<>();
        synchronized (lock) {
            for (Entry entry : new ArrayList<>(entries.values())) {
                if (entry.state != QueueJobState.ACTIVE || entry.lastHeartbeat >= threshold) {
                    continue;
                }
                activeCount--;
                entry.generation++;
                entry.stalledCount++;
                entry.progress = 0;
                if (entry.stalledCount > settings.getMaxStalledCount()) {
                    entry.attemptsMade++;
                    entry.failedReason = STALLED_REASON;
                    exhausted.add(fail(entry));
                } else {
                    entry.state = QueueJobState.WAITING;
                    waiting.add(entry);
                    stalled.add(entry.snapshot());
                }
            }
        }
        for (QueueJob job : stalled) {
            log.warn("[{}] Job {} sent no heartbeat for {}ms; moved back to waiting.", name.getValue(), job.getId(),
                     settings.getStalledIntervalMs());
            notifyListeners(listener -> listener.onStalled(name, job));
        }
        for (QueueJob job : exhausted) {
            log.error("[{}] Job {} failed: {}.", name.getValue(), job.getId(), STALLED_REASON);
            JobStateException error = new JobStateException("Job " + job.getId() + " " + STALLED_REASON);
            notifyListeners(listener -> listener.onStalled(name, job));
            notifyListeners(listener -> listener.onFailed(name, job, error));
        }
        if (!stalled.isEmpty() || !exhausted.isEmpty()) {
            dispatch();
        }
    }

    private void enforceRetention(Deque<Entry> finished, int maxCount, long maxAgeMs) {
        long cutoff = now() - maxAgeMs;
        while (!finished.isEmpty()
                && (finished.size() > maxCount || finished.peekFirst().finishedOn < cutoff)) {
            entries.remove(finished.removeFirst().id);
        }
    }

    private void discard(Entry entry) {
        cancel(entry.timer);
        waiting.remove(entry);
        completed.remove(entry);
        failed.remove(entry);
        entries.remove(entry.id);
    }

    private List<QueueJob> snapshotsIn(QueueJobState state) {
        synchronized (lock) {
            return entries.values().stream()
                    .filter(entry -> entry.state == state)
                    .sorted(DISPATCH_ORDER)
                    .map(Entry::snapshot)
                    .toList();
        }
    }

    private long countIn(QueueJobState state) {
        return entries.values().stream().filter(entry -> entry.state == state).count();
    }

    private QueueJob snapshotOf(Entry entry) {
        synchronized (lock) {
            return entry.snapshot();
        }
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

    private long now() {
        return clock.millis();
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static final class Entry {
        private final String id;
        private final String name;
        private final JobPayload payload;
        private final JobOptions options;
        private final int priority;
        private final int attempts;
        private final long sequence;
        private final long timestamp;

        private QueueJobState state;
        private int attemptsMade;
        private int progress;
        private Map<String, Object> returnValue;
        private String failedReason;
        private Long processedOn;
        private Long finishedOn;
        private long lastHeartbeat;
        private int generation;
        private int stalledCount;
        private ScheduledFuture<?> timer;

        private Entry(String id, String name, JobPayload payload, JobOptions options, int defaultAttempts,
                      long sequence, long timestamp) {
            this.id = id;
            this.name = name;
            this.payload = payload;
            this.options = options;
            this.priority = Optional.ofNullable(options.getPriority()).orElse(0);
            this.attempts = Math.max(1, Optional.ofNullable(options.getAttempts()).orElse(defaultAttempts));
            this.attemptsMade = Math.max(0, Optional.ofNullable(options.getAttemptsMade()).orElse(0));
            this.sequence = sequence;
            this.timestamp = timestamp;
        }

        private QueueJob snapshot() {
            return QueueJob.builder()
                    .id(id)
                    .name(name)
                    .payload(payload)
                    .priority(priority)
                    .attempts(attempts)
                    .attemptsMade(attemptsMade)
                    .state(state)
                    .progress(progress)
                    .returnValue(returnValue)
                    .failedReason(failedReason)
                    .timestamp(timestamp)
                    .processedOn(processedOn)
                    .finishedOn(finishedOn)
                    .build();
        }
    }
}
