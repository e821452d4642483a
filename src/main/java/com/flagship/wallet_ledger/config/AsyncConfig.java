package com.flagship.wallet_ledger.config;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Executor for the best-effort recipient log append.
 *
 * Bounded queue: when it is full the append is dropped and logged by the caller.
 */
@Configuration
public class AsyncConfig {

    public static final String RECIPIENT_LOG_EXECUTOR = "recipientLogExecutor";

    @Bean(name = RECIPIENT_LOG_EXECUTOR)
    public ThreadPoolTaskExecutor recipientLogExecutor(
            @Value("${wallet.recipient-log.pool-size:4}") int poolSize,
            @Value("${wallet.recipient-log.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("recipient-log-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Carries the submitting thread's MDC (correlationId, accountId) into the task.
     */
    static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
