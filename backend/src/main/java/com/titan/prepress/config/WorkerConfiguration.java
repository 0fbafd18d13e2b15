package com.titan.prepress.config;

import com.titan.prepress.service.JobStore;
import com.titan.prepress.service.PreflightPipeline;
import com.titan.prepress.storage.LocalJobStorage;
import com.titan.prepress.worker.CleanupSweeper;
import com.titan.prepress.worker.JobPoller;
import com.titan.prepress.worker.JobProcessor;
import com.titan.prepress.worker.WorkerRuntime;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Background processing for this process. {@code prepress.worker.enabled} and
 * {@code prepress.cleanup.enabled} decide what the runtime starts.
 */
@Configuration
public class WorkerConfiguration {

    @Bean
    public JobProcessor jobProcessor(JobStore jobStore, PreflightPipeline pipeline, LocalJobStorage storage) {
        return new JobProcessor(jobStore, pipeline, storage);
    }

    @Bean
    public JobPoller jobPoller(JobProcessor jobProcessor, PrepressProperties properties) {
        PrepressProperties.Worker worker = properties.getWorker();
        return new JobPoller(jobProcessor, worker.getConcurrency(), worker.getPollIntervalMs());
    }

    @Bean
    public CleanupSweeper cleanupSweeper(JobStore jobStore, LocalJobStorage storage, PrepressProperties properties) {
        PrepressProperties.Cleanup cleanup = properties.getCleanup();
        return new CleanupSweeper(jobStore, storage, cleanup.getIntervalMs(), cleanup.getBatchSize(),
                Duration.ofMillis(cleanup.getRunningGraceMs()));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public WorkerRuntime workerRuntime(JobPoller jobPoller, CleanupSweeper cleanupSweeper, PrepressProperties properties) {
        return new WorkerRuntime(
                properties.getWorker().isEnabled() ? jobPoller : null,
                properties.getCleanup().isEnabled() ? cleanupSweeper : null);
    }
}
