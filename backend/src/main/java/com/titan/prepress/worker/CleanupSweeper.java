package com.titan.prepress.worker;

import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.service.JobStore;
import com.titan.prepress.storage.LocalJobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deletes expired jobs: first the job directory, then the row with its findings and fix logs.
 * This is also how a job orphaned in {@code running} by a crashed worker is eventually removed.
 */
public class CleanupSweeper {

    private static final Logger logger = LoggerFactory.getLogger(CleanupSweeper.class);

    private final JobStore jobStore;
    private final LocalJobStorage storage;
    private final long intervalMs;
    private final int batchSize;
    private final Duration runningGrace;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> schedule;

    public CleanupSweeper(JobStore jobStore, LocalJobStorage storage, long intervalMs, int batchSize,
                          Duration runningGrace) {
        this.jobStore = jobStore;
        this.storage = storage;
        this.intervalMs = intervalMs;
        this.batchSize = batchSize;
        this.runningGrace = runningGrace;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("prepress-cleanup-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        schedule = scheduler.scheduleAtFixedRate(this::safeSweep, Duration.ofMillis(intervalMs));
        logger.info("Cleanup sweeper started (interval {} ms)", intervalMs);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        schedule.cancel(false);
        schedule = null;
        scheduler.shutdown();
        logger.info("Cleanup sweeper stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    synchronized boolean isScheduled() {
        return schedule != null && !schedule.isCancelled();
    }

    /**
     * @return number of jobs removed
     */
    public int sweep() {
        List<PrepressJob> expired = jobStore.findExpired(batchSize, runningGrace);
        if (expired.isEmpty()) {
            return 0;
        }
        int deleted = 0;
        for (PrepressJob job : expired) {
            try {
                storage.deleteJobDirectory(job.getId());
                jobStore.deleteJob(job.getId());
                deleted++;
            } catch (Exception e) {
                logger.error("Failed to clean up expired job {}", job.getId(), e);
            }
        }
        logger.info("Cleanup sweep removed {} of {} expired job(s)", deleted, expired.size());
        return deleted;
    }

    private void safeSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception would cancel the fixed-rate schedule
            logger.error("Cleanup sweep failed", e);
        }
    }
}
