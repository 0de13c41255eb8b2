/**
 * Configuration for the thread pools used by mosaic composition
 *
 * @author William Callahan
 *
 * Features:
 * - Configures a CPU-bound pool for per-cell tile matching
 * - Implements custom thread naming for easier debugging
 * - Falls back to the caller thread when saturated
 */

package com.williamcallahan.photo_mosaic_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Creates the thread pool task executor for CPU-intensive cell matching
     *
     * @param properties mosaic configuration, read for the composer parallelism
     * @return Configured AsyncTaskExecutor for composition tasks
     *
     * Features:
     * - Core and max pool size based on available processors unless configured
     * - Large queue capacity since one task is queued per grid cell
     * - Descriptive thread naming pattern for monitoring
     * - Fallback to caller thread when saturated (CallerRunsPolicy)
     */
    @Bean("mosaicComposerExecutor")
    public AsyncTaskExecutor mosaicComposerExecutor(MosaicConfigurationProperties properties) {
        int configured = properties.getComposer().getParallelism();
        int processors = Runtime.getRuntime().availableProcessors();
        int poolSize = configured > 0 ? configured : Math.max(2, processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(20_000);
        executor.setThreadNamePrefix("mosaic-compose-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        logger.info("Mosaic composer executor initialized with {} threads", poolSize);
        return executor;
    }
}
