package com.titan.prepress.service;

import com.titan.prepress.model.JobError;
import com.titan.prepress.model.JobStatus;
import com.titan.prepress.model.OutputManifest;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.model.ReportSummary;
import com.titan.prepress.repository.FindingRepository;
import com.titan.prepress.repository.FixLogRepository;
import com.titan.prepress.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable job rows and their state machine. The only way into {@code running} is {@link #claim()},
 * and terminal states are only ever reached from the state that precedes them.
 */
@Service
@RequiredArgsConstructor
public class JobStore {

    private static final Logger logger = LoggerFactory.getLogger(JobStore.class);

    static final int CLAIM_CANDIDATES = 5;
    static final String CLAIMED_MESSAGE = "Claimed by worker, starting preflight";

    private final JobRepository jobRepository;
    private final FindingRepository findingRepository;
    private final FixLogRepository fixLogRepository;
    private final Clock clock;

    public PrepressJob insertQueued(PrepressJob job) {
        job.setStatus(JobStatus.QUEUED);
        return jobRepository.save(job);
    }

    /**
     * Claims the oldest queued job. Candidates are tried in order; each attempt is a single
     * conditional update, so concurrent callers in any process can win a given row at most once.
     */
    public Optional<PrepressJob> claim() {
        List<UUID> candidates = jobRepository.findIdsByStatusOldestFirst(JobStatus.QUEUED,
                PageRequest.of(0, CLAIM_CANDIDATES));
        for (UUID id : candidates) {
            if (tryClaim(id)) {
                Optional<PrepressJob> claimed = jobRepository.findById(id);
                claimed.ifPresent(job -> logger.info("Claimed job {}", job.getId()));
                return claimed;
            }
        }
        return Optional.empty();
    }

    private boolean tryClaim(UUID id) {
        try {
            return jobRepository.claimIfQueued(id, clock.instant(), CLAIMED_MESSAGE,
                    JobStatus.QUEUED, JobStatus.RUNNING) == 1;
        } catch (DataAccessException e) {
            // lock timeouts and serialization failures mean another worker holds the row
            logger.debug("Lost claim race for job {}: {}", id, e.getMessage());
            return false;
        }
    }

    public void updateProgress(UUID jobId, String message) {
        jobRepository.updateProgress(jobId, message, JobStatus.RUNNING);
    }

    @Transactional
    public boolean markSucceeded(UUID jobId, ReportSummary summary, OutputManifest manifest) {
        return finishRunning(jobId, job -> {
            job.setStatus(JobStatus.SUCCEEDED);
            job.setReportSummary(summary);
            job.setOutputManifest(manifest);
            job.setProgressMessage("Completed successfully");
        });
    }

    @Transactional
    public boolean markFailed(UUID jobId, JobError error) {
        return finishRunning(jobId, job -> {
            job.setStatus(JobStatus.FAILED);
            job.setError(error);
            job.setProgressMessage("Failed: " + error.getMessage());
        });
    }

    private boolean finishRunning(UUID jobId, Consumer<PrepressJob> transition) {
        Optional<PrepressJob> locked = jobRepository.findByIdForUpdate(jobId);
        if (locked.isEmpty() || locked.get().getStatus() != JobStatus.RUNNING) {
            logger.warn("Job {} is no longer running, final state not recorded", jobId);
            return false;
        }
        PrepressJob job = locked.get();
        transition.accept(job);
        job.setFinishedAt(clock.instant());
        jobRepository.save(job);
        return true;
    }

    public boolean cancel(UUID jobId) {
        return jobRepository.cancelIfQueued(jobId, clock.instant(), "Cancelled",
                JobStatus.QUEUED, JobStatus.CANCELLED) == 1;
    }

    public Optional<PrepressJob> find(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    public List<PrepressJob> findExpired(int limit, Duration runningGrace) {
        Instant now = clock.instant();
        return jobRepository.findExpired(now, JobStatus.RUNNING, now.minus(runningGrace), PageRequest.of(0, limit));
    }

    /**
     * Removes the row together with its findings and fix logs.
     */
    @Transactional
    public void deleteJob(UUID jobId) {
        int findings = findingRepository.deleteByJobId(jobId);
        int fixes = fixLogRepository.deleteByJobId(jobId);
        jobRepository.deleteById(jobId);
        logger.debug("Deleted job {} ({} findings, {} fix logs)", jobId, findings, fixes);
    }
}
