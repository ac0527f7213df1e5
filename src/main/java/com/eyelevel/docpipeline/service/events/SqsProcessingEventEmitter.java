package com.eyelevel.docpipeline.service.events;

import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes lifecycle events to an SQS queue for the real-time notification service.
 * Sends are asynchronous; a failed send is logged by the returned future.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.events.sqs.enabled", havingValue = "true")
public class SqsProcessingEventEmitter extends AbstractProcessingEventEmitter {

    private static final String EVENT_TYPE_HEADER = "eventType";

    private final SqsTemplate sqsTemplate;
    private final String queueName;

    public SqsProcessingEventEmitter(SqsTemplate sqsTemplate, Clock clock,
                                     @Value("${app.events.sqs.queue:document-processing-events}") String queueName) {
        super(clock);
        this.sqsTemplate = sqsTemplate;
        this.queueName = queueName;
        log.info("Publishing processing events to SQS queue '{}'.", queueName);
    }

    @Override
    protected void publish(ProcessingEvent event) {
        sqsTemplate.sendAsync(queueName, MessageBuilder.withPayload(event)
                        .setHeader(EVENT_TYPE_HEADER, event.getEvent())
                        .build())
                .exceptionally(ex -> {
                    log.warn("[JobId: {}] SQS delivery of '{}' failed: {}", event.getJobId(), event.getEvent(),
                             ex.getMessage());
                    return null;
                });
    }
}
