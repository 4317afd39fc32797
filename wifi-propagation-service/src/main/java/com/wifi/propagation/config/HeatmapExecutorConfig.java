package com.wifi.propagation.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool for heatmap row bands.
 * Row bands are short CPU-bound tasks, so the pool is sized by configuration and never grows.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class HeatmapExecutorConfig {

    public static final String HEATMAP_EXECUTOR = "heatmapExecutor";

    private final PropagationProperties propagationProperties;

    private ThreadPoolTaskExecutor heatmapExecutor;

    @Bean(name = HEATMAP_EXECUTOR)
    public ThreadPoolTaskExecutor heatmapExecutor() {
        PropagationProperties.Computation computation = propagationProperties.getComputation();
        int workers = Math.max(1, computation.getWorkers());

        heatmapExecutor = new ThreadPoolTaskExecutor();
        heatmapExecutor.setCorePoolSize(workers);
        heatmapExecutor.setMaxPoolSize(workers);
        heatmapExecutor.setQueueCapacity(computation.getQueueCapacity());
        heatmapExecutor.setThreadNamePrefix("heatmap-worker-");
        heatmapExecutor.setKeepAliveSeconds(60);
        heatmapExecutor.setAllowCoreThreadTimeOut(true);
        heatmapExecutor.setRejectedExecutionHandler(new CallerRunsWhenSaturated());
        heatmapExecutor.setWaitForTasksToCompleteOnShutdown(true);
        heatmapExecutor.setAwaitTerminationSeconds(30);
        heatmapExecutor.initialize();

        log.info("Initialized heatmap executor - workers: {}, queueCapacity: {}, timeoutSeconds: {}",
            workers, computation.getQueueCapacity(), computation.getTimeoutSeconds());

        return heatmapExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (heatmapExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = heatmapExecutor.getThreadPoolExecutor();
        log.info("Shutting down heatmap executor - Queue size: {}, Active threads: {}",
            executor.getQueue().size(), executor.getActiveCount());

        heatmapExecutor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Heatmap workers did not finish within 30 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Heatmap executor shutdown interrupted, forcing immediate termination");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a rejected row band on the submitting thread while the pool is saturated. Once the pool
     * is shut down the band is rejected so the caller fails at once.
     */
    private static class CallerRunsWhenSaturated implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                log.warn("Heatmap executor is shut down - rejecting row band");
                throw new RejectedExecutionException("Heatmap executor is shut down");
            }
            log.warn("Heatmap executor saturated - running row band on caller thread. " +
                    "Active threads: {}, Queue size: {}", executor.getActiveCount(), executor.getQueue().size());
            r.run();
        }
    }
}
