package com.titan.prepress.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-delay polling loop. Each tick runs up to {@code concurrency} claim-and-process
 * attempts in parallel and schedules the next tick only while the poller is running.
 */
public class JobPoller {

    private static final Logger logger = LoggerFactory.getLogger(JobPoller.class);

    private final JobProcessor processor;
    private final int concurrency;
    private final long intervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ThreadPoolTaskScheduler scheduler;
    private ThreadPoolTaskExecutor workers;
    private ScheduledFuture<?> nextTick;
    // bumped on every start so a tick left over from an earlier run cannot reschedule itself
    private long generation;

    public JobPoller(JobProcessor processor, int concurrency, long intervalMs) {
        this.processor = processor;
        this.concurrency = Math.max(1, concurrency);
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("prepress-poller-");
        scheduler.setDaemon(true);
        scheduler.initialize();

        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(concurrency);
        workers.setMaxPoolSize(concurrency);
        workers.setThreadNamePrefix("prepress-worker-");
        workers.setDaemon(true);
        workers.setWaitForTasksToCompleteOnShutdown(true);
        workers.setAwaitTerminationSeconds(30);
        workers.initialize();

        logger.info("Job poller started (concurrency {}, interval {} ms)", concurrency, intervalMs);
        long run = ++generation;
        nextTick = scheduler.schedule(() -> tick(run), Instant.now());
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (nextTick != null) {
            nextTick.cancel(false);
            nextTick = null;
        }
        scheduler.shutdown();
        // blocks up to 30 s for in-flight attempts
        workers.shutdown();
        logger.info("Job poller stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One polling round on the caller's thread plus the worker pool.
     *
     * @return how many jobs were processed
     */
    int pollOnce(AsyncTaskExecutor pool) {
        List<Future<Boolean>> attempts = new ArrayList<>(concurrency);
        for (int i = 0; i < concurrency; i++) {
            attempts.add(pool.submit(processor::processOneJob));
        }
        int processed = 0;
        for (Future<Boolean> attempt : attempts) {
            try {
                if (Boolean.TRUE.equals(attempt.get())) {
                    processed++;
                }
            } catch (ExecutionException e) {
                logger.error("Poll attempt failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return processed;
    }

    private void tick(long run) {
        try {
            int processed = pollOnce(workers);
            if (processed > 0) {
                logger.info("Processed {} job(s)", processed);
            }
        } catch (RuntimeException e) {
            logger.error("Poll tick failed", e);
        } finally {
            scheduleNext(run);
        }
    }

    private synchronized void scheduleNext(long run) {
        if (running.get() && run == generation) {
            nextTick = scheduler.schedule(() -> tick(run), Instant.now().plusMillis(intervalMs));
        }
    }

    synchronized boolean hasPendingTick() {
        return nextTick != null && !nextTick.isDone();
    }
}
