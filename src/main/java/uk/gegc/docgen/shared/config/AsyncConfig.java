package uk.gegc.docgen.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for the per-diagram upstream calls of full generation.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${docgen.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${docgen.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${docgen.async.queue-capacity:100}")
    private int queueCapacity;

    @Value("${docgen.async.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    /**
     * Diagram calls block on upstream I/O and backoff waits, so the pool is sized for waiting rather than CPU.
     * A full queue runs the call on the request thread.
     */
    @Bean(name = "generationTaskExecutor")
    public Executor generationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("docgen-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Generation Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);
        return executor;
    }

    private static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
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
