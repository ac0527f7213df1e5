package com.eyelevel.docpipeline.config;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.common.json.JsonSerializer;
import com.eyelevel.docpipeline.service.queue.*;
import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.MessageListenerContainer;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the named job queues once at startup from {@link PipelineProperties}.
 * <p>
 * With the SQS backend every queue, the legacy one included, is an SQS queue with its own listener container.
 * The local backend keeps jobs in process and has no legacy queue, as nothing could ever have been left on it.
 */
@Slf4j
@Configuration
public class QueueConfig {

    @Bean
    public ProcessingQueues processingQueues(PipelineProperties properties,
                                             @Qualifier("queueTimerScheduler") TaskScheduler scheduler, Clock clock,
                                             ObjectProvider<SqsTemplate> sqsTemplates,
                                             ObjectProvider<SqsAsyncClient> sqsAsyncClients,
                                             JsonSerializer jsonSerializer, JsonParser jsonParser) {
        PipelineProperties.Queues queues = properties.getQueues();
        Map<QueueName, JobQueue> primary = new EnumMap<>(QueueName.class);
        if (queues.getBackend() == QueueBackend.LOCAL) {
            log.info("Using in-process job queues.");
            for (QueueName name : QueueName.PRIMARY) {
                primary.put(name, createLocalQueue(name, properties, scheduler, clock));
            }
            return new ProcessingQueues(primary, null);
        }

        SqsAsyncClient sqsAsyncClient = sqsAsyncClients.getObject();
        SqsTemplate sqsTemplate = sqsTemplates.getIfAvailable(
                () -> SqsTemplate.builder().sqsAsyncClient(sqsAsyncClient).build());
        log.info("Using SQS job queues.");
        for (QueueName name : QueueName.PRIMARY) {
            primary.put(name, createSqsQueue(name, properties, sqsTemplate, sqsAsyncClient, jsonSerializer,
                    jsonParser, clock));
        }
        JobQueue legacy = queues.isLegacyEnabled()
                ? createSqsQueue(QueueName.LEGACY, properties, sqsTemplate, sqsAsyncClient, jsonSerializer,
                        jsonParser, clock)
                : null;
        return new ProcessingQueues(primary, legacy);
    }

    private LocalJobQueue createLocalQueue(QueueName name, PipelineProperties properties, TaskScheduler scheduler,
                                           Clock clock) {
        QueueSettings settings = settingsFor(name, properties);
        return new LocalJobQueue(name, settings,
                TaskExecutorConfig.queueWorkerExecutor(name.getValue(), settings.getConcurrency()), scheduler, clock);
    }

    private SqsJobQueue createSqsQueue(QueueName name, PipelineProperties properties, SqsTemplate sqsTemplate,
                                       SqsAsyncClient sqsAsyncClient, JsonSerializer jsonSerializer,
                                       JsonParser jsonParser, Clock clock) {
        QueueSettings settings = settingsFor(name, properties);
        String sqsQueue = properties.getQueues().sqsQueueFor(name);
        int concurrency = settings.getConcurrency();
        int pollTimeoutSeconds = properties.getQueues().getPollTimeoutSeconds();

        SqsMessageListenerContainerFactory<String> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(concurrency)
                                            .maxMessagesPerPoll(Math.min(concurrency, 10))
                                            .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds))
                                            .messageVisibility(Duration.ofSeconds(
                                                    SqsJobQueue.visibilitySecondsFor(settings)))
                                            .messageSystemAttributeNames(List.of(MessageSystemAttributeName.ALL)));
        MessageListenerContainer<String> container = factory.createContainer(sqsQueue);
        container.setId(name.getValue() + "-container");
        log.info("SQS queue '{}' -> '{}' with concurrency {}.", name.getValue(), sqsQueue, concurrency);
        return new SqsJobQueue(name, sqsQueue, settings, sqsTemplate, sqsAsyncClient, container, jsonSerializer,
                jsonParser, clock);
    }

    private static QueueSettings settingsFor(QueueName name, PipelineProperties properties) {
        PipelineProperties.QueueProperties queue = properties.getQueues().forQueue(name);
        QueueSettings settings = QueueSettings.builder()
                .concurrency(queue.getConcurrency())
                .rateLimitMax(queue.getRateLimit().getMax())
                .rateLimitDurationMs(queue.getRateLimit().getDurationMs())
                .defaultAttempts(properties.getRetry().getAttempts())
                .backoffMs(properties.getRetry().getDelayMs())
                .completedRetentionMs(properties.getRetention().getCompletedAgeMs())
                .completedRetentionCount(properties.getRetention().getCompletedCount())
                .failedRetentionMs(properties.getRetention().getFailedAgeMs())
                .failedRetentionCount(properties.getRetention().getFailedCount())
                .stalledIntervalMs(properties.getStalledIntervalMs())
                .build();
        log.info("Configuring queue '{}' with concurrency {} and rate limit {}/{}ms.", name.getValue(),
                 settings.getConcurrency(), settings.getRateLimitMax(), settings.getRateLimitDurationMs());
        return settings;
    }
}
