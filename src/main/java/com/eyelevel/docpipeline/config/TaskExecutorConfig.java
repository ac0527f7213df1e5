package com.eyelevel.docpipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configures the shared thread pools: the general async executor and the timer pool used by the job queues
 * for delayed delivery, rate-limit wake-ups and stall checks. Queue worker pools are created per queue in
 * {@link QueueConfig}.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the primary thread pool for async tasks. The properties for this pool are
     * configured in application.yml under the `spring.task.execution.pool` prefix.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("app-task-");
        executor.initialize();
        return executor;
    }

    @Bean("queueTimerScheduler")
    public TaskScheduler queueTimerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("queue-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Builds the worker pool of one queue: {@code concurrency} threads named after the queue.
     */
    public static ThreadPoolTaskExecutor queueWorkerExecutor(String queueName, int concurrency) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix(queueName + "-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
