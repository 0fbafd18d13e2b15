package com.titan.prepress.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the background components of one process. Either component may be absent when the
 * process only serves the API.
 */
public class WorkerRuntime {

    private static final Logger logger = LoggerFactory.getLogger(WorkerRuntime.class);

    private final JobPoller poller;
    private final CleanupSweeper sweeper;

    public WorkerRuntime(JobPoller poller, CleanupSweeper sweeper) {
        this.poller = poller;
        this.sweeper = sweeper;
    }

    public void start() {
        if (poller != null) {
            poller.start();
        }
        if (sweeper != null) {
            sweeper.start();
        }
        if (poller == null && sweeper == null) {
            logger.info("Worker runtime has nothing to run in this process");
        }
    }

    public void stop() {
        if (poller != null) {
            poller.stop();
        }
        if (sweeper != null) {
            sweeper.stop();
        }
    }

    public boolean isPolling() {
        return poller != null && poller.isRunning();
    }

    public boolean isSweeping() {
        return sweeper != null && sweeper.isRunning();
    }
}
