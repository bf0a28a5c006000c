package com.example.interviewreminder.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for reminder processing and Spring's {@code @Async} methods.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Bounded pool running reminder jobs. Its size is the queue concurrency.
     * The container shuts it down after {@code ReminderPipelineLifecycle} has drained it.
     */
    @Bean(name = "reminderWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService reminderWorkerExecutor(ReminderQueueProperties properties) {
        log.info("Creating reminder worker pool with {} threads", properties.getConcurrency());

        return Executors.newFixedThreadPool(properties.getConcurrency(), new CustomizableThreadFactory("reminder-worker-"));
    }

    /**
     * Task executor for Spring's @Async annotation (Slack alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Alert rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
