package com.eyelevel.docpipeline.service.queue;

import com.eyelevel.docpipeline.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.util.*;

/**
 * Holds one {@link JobQueue} per {@link QueueName}, built once at startup.
 * <p>
 * The legacy queue is optional. New jobs never go to it; it is drained by its worker and consulted as a second
 * lookup when finding or removing a job.
 */
@Slf4j
public class ProcessingQueues implements DisposableBean {

    private final Map<QueueName, JobQueue> primary;
    private final JobQueue legacy;

    public ProcessingQueues(Map<QueueName, JobQueue> primary, JobQueue legacy) {
        for (QueueName name : QueueName.PRIMARY) {
            if (!primary.containsKey(name)) {
                throw new IllegalArgumentException("No queue configured for " + name.getValue());
            }
        }
        this.primary = Collections.unmodifiableMap(new EnumMap<>(primary));
        this.legacy = legacy;
    }

    public JobQueue get(QueueName name) {
        if (name == QueueName.LEGACY) {
            return legacy().orElseThrow(() -> new ResourceNotFoundException("Queue not found: " + name.getValue()));
        }
        return primary.get(name);
    }

    /**
     * Looks a queue up by its external name, e.g. {@code ocr-queue}.
     */
    public JobQueue getByValue(String queueName) {
        return QueueName.fromValue(queueName)
                .filter(name -> name != QueueName.LEGACY || legacy != null)
                .map(this::get)
                .orElseThrow(() -> new ResourceNotFoundException("Queue not found: " + queueName));
    }

    public Optional<JobQueue> legacy() {
        return Optional.ofNullable(legacy);
    }

    public Collection<JobQueue> primaryQueues() {
        return primary.values();
    }

    /**
     * Every registered queue, primary queues first.
     */
    public List<JobQueue> all() {
        List<JobQueue> all = new ArrayList<>(primary.values());
        legacy().ifPresent(all::add);
        return all;
    }

    @Override
    public void destroy() {
        all().forEach(queue -> {
            log.info("Closing queue {}.", queue.getName().getValue());
            queue.close();
        });
    }
}
