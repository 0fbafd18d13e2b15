package com.titan.prepress.worker;

import com.titan.prepress.model.JobError;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.service.JobStore;
import com.titan.prepress.service.PipelineOutcome;
import com.titan.prepress.service.PreflightPipeline;
import com.titan.prepress.service.PrepressException;
import com.titan.prepress.storage.LocalJobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims one job, runs the pipeline on it and records the terminal state.
 */
public class JobProcessor {

    private static final Logger logger = LoggerFactory.getLogger(JobProcessor.class);

    private final JobStore jobStore;
    private final PreflightPipeline pipeline;
    private final LocalJobStorage storage;

    public JobProcessor(JobStore jobStore, PreflightPipeline pipeline, LocalJobStorage storage) {
        this.jobStore = jobStore;
        this.pipeline = pipeline;
        this.storage = storage;
    }

    /**
     * @return true if a job was claimed and processed, false if the queue was empty
     */
    public boolean processOneJob() {
        Optional<PrepressJob> claimed = jobStore.claim();
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    void process(PrepressJob job) {
        UUID jobId = job.getId();
        try {
            PipelineOutcome outcome = pipeline.run(job, message -> reportProgress(jobId, message));
            jobStore.markSucceeded(jobId, outcome.summary(), outcome.getManifest());
            logger.info("Job {} succeeded with score {}", jobId, outcome.getReport().getSummary().getScore());
        } catch (Exception e) {
            logger.error("Job {} failed", jobId, e);
            markFailed(jobId, e);
        } finally {
            if (!storage.deleteInput(jobId)) {
                logger.warn("Scratch input of job {} left behind for the TTL sweep", jobId);
            }
        }
    }

    private void markFailed(UUID jobId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", cause.getClass().getName());
        details.put("stack", stackTrace(cause));
        try {
            jobStore.markFailed(jobId, JobError.builder()
                    .message(message)
                    .code(PrepressException.codeOf(cause))
                    .details(details)
                    .build());
        } catch (RuntimeException e) {
            logger.error("Could not record failure of job {}", jobId, e);
        }
    }

    private void reportProgress(UUID jobId, String message) {
        try {
            jobStore.updateProgress(jobId, message);
        } catch (RuntimeException e) {
            logger.debug("Progress update for job {} failed: {}", jobId, e.getMessage());
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter writer = new StringWriter();
        t.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
