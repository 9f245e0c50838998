package com.github.dimitryivaniuta.gateway.smartpay.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work that must not run on the request thread.
 *
 * <ul>
 *   <li>{@value #RELAY_EXECUTOR}: bounded pool for relay calls to the store callback. When the pool and
 *   queue are full the submitting thread runs the call itself, which throttles the poller.</li>
 *   <li>{@value #STATUS_LOG_EXECUTOR}: small pool for status log writes. When its queue is full the write is
 *   rejected; {@code PaymentStatusLogger} logs the rejected entry as a warning, the log is
 *   best effort.</li>
 * </ul>
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String RELAY_EXECUTOR = "relayExecutor";
    public static final String STATUS_LOG_EXECUTOR = "statusLogExecutor";

    /**
     * Relay fan-out executor.
     *
     * @param props application properties
     * @return executor
     */
    @Bean(name = RELAY_EXECUTOR)
    public ThreadPoolTaskExecutor relayExecutor(AppProperties props) {
        AppProperties.Relay relay = props.getRelay();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relay.getMaxConcurrency());
        executor.setMaxPoolSize(relay.getMaxConcurrency());
        executor.setQueueCapacity(relay.getQueueCapacity());
        executor.setThreadNamePrefix("relay-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) relay.getTimeout().toSeconds());
        executor.initialize();

        log.info("Relay executor ready. maxConcurrency={} queueCapacity={}", relay.getMaxConcurrency(), relay.getQueueCapacity());
        return executor;
    }

    /**
     * Status log executor.
     *
     * @return executor
     */
    @Bean(name = STATUS_LOG_EXECUTOR)
    public ThreadPoolTaskExecutor statusLogExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("status-log-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's MDC (correlation id) onto the worker thread.
     *
     * @return task decorator
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
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
