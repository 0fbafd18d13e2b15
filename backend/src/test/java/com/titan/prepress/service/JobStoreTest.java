package com.titan.prepress.service;

import com.titan.prepress.JobFixtures;
import com.titan.prepress.model.JobError;
import com.titan.prepress.model.JobStatus;
import com.titan.prepress.model.OutputManifest;
import com.titan.prepress.model.PrepressJob;
import com.titan.prepress.model.ReportSummary;
import com.titan.prepress.report.IssueCounts;
import com.titan.prepress.repository.FindingRepository;
import com.titan.prepress.repository.FixLogRepository;
import com.titan.prepress.repository.JobRepository;
import com.titan.prepress.toolchain.ToolRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class JobStoreTest {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private FindingRepository findingRepository;

    @Autowired
    private FixLogRepository fixLogRepository;

    @MockBean
    private ToolRunner toolRunner;

    @BeforeEach
    void setup() {
        findingRepository.deleteAll();
        fixLogRepository.deleteAll();
        jobRepository.deleteAll();
    }

    private PrepressJob queued(Instant createdAt) {
        PrepressJob job = JobFixtures.job(JobStatus.QUEUED, createdAt);
        return jobStore.insertQueued(job);
    }

    @Test
    void claimOnEmptyQueueFindsNothing() {
        for (int i = 0; i < 5; i++) {
            assertTrue(jobStore.claim().isEmpty());
        }
        assertEquals(0, jobRepository.count());
    }

    @Test
    void claimTakesOldestQueuedJobFirst() {
        Instant now = Instant.now();
        PrepressJob newer = queued(now);
        PrepressJob older = queued(now.minusSeconds(60));

        PrepressJob claimed = jobStore.claim().orElseThrow();

        assertEquals(older.getId(), claimed.getId());
        assertEquals(JobStatus.RUNNING, claimed.getStatus());
        assertNotNull(claimed.getStartedAt());
        assertEquals(JobStatus.QUEUED, jobStore.find(newer.getId()).orElseThrow().getStatus());
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        PrepressJob job = queued(Instant.now());
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<Optional<PrepressJob>>> attempts = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                Callable<Optional<PrepressJob>> attempt = () -> {
                    start.await();
                    return jobStore.claim();
                };
                attempts.add(pool.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<PrepressJob>> attempt : attempts) {
                Optional<PrepressJob> claimed = attempt.get(30, TimeUnit.SECONDS);
                if (claimed.isPresent()) {
                    assertEquals(job.getId(), claimed.get().getId());
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(JobStatus.RUNNING, jobStore.find(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void successIsRecordedOnlyForRunningJobs() {
        PrepressJob job = queued(Instant.now());
        ReportSummary summary = ReportSummary.builder().score(100.0).counts(new IssueCounts()).pageCount(1).build();
        OutputManifest manifest = OutputManifest.builder().reportJson(true).proofPng(true).build();

        assertFalse(jobStore.markSucceeded(job.getId(), summary, manifest));

        jobStore.claim();
        assertTrue(jobStore.markSucceeded(job.getId(), summary, manifest));

        PrepressJob done = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, done.getStatus());
        assertNotNull(done.getFinishedAt());
        assertEquals(100.0, done.getReportSummary().getScore());
        assertTrue(done.getOutputManifest().isProofPng());

        assertFalse(jobStore.markFailed(job.getId(), JobError.builder().message("late").build()));
        assertEquals(JobStatus.SUCCEEDED, jobStore.find(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void failureKeepsTheErrorDetails() {
        PrepressJob job = queued(Instant.now());
        jobStore.claim();

        assertTrue(jobStore.markFailed(job.getId(), JobError.builder().message("boom").code("STORAGE_ERROR").build()));

        PrepressJob failed = jobStore.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals("boom", failed.getError().getMessage());
        assertEquals("STORAGE_ERROR", failed.getError().getCode());
    }

    @Test
    void onlyQueuedJobsCanBeCancelled() {
        PrepressJob first = queued(Instant.now().minusSeconds(10));
        PrepressJob second = queued(Instant.now());

        assertTrue(jobStore.cancel(second.getId()));
        assertEquals(JobStatus.CANCELLED, jobStore.find(second.getId()).orElseThrow().getStatus());

        jobStore.claim();
        assertFalse(jobStore.cancel(first.getId()));
        assertFalse(jobStore.cancel(UUID.randomUUID()));
        // a cancelled job is never claimed
        assertTrue(jobStore.claim().isEmpty());
    }

    @Test
    void progressIsOnlyWrittenWhileRunning() {
        PrepressJob job = queued(Instant.now());

        jobStore.updateProgress(job.getId(), "Checking fonts");
        assertEquals("Queued", jobStore.find(job.getId()).orElseThrow().getProgressMessage());

        jobStore.claim();
        jobStore.updateProgress(job.getId(), "Checking fonts");
        assertEquals("Checking fonts", jobStore.find(job.getId()).orElseThrow().getProgressMessage());
    }

    @Test
    void expiredSelectionSparesRecentlyStartedJobs() {
        Instant now = Instant.now();
        PrepressJob expiredDone = jobRepository.save(JobFixtures.expiredJob(JobStatus.SUCCEEDED, now));
        PrepressJob fresh = jobRepository.save(JobFixtures.job(JobStatus.SUCCEEDED, now));
        PrepressJob busy = JobFixtures.expiredJob(JobStatus.RUNNING, now);
        busy.setStartedAt(now.minusSeconds(30));
        jobRepository.save(busy);
        PrepressJob orphaned = JobFixtures.expiredJob(JobStatus.RUNNING, now);
        orphaned.setStartedAt(now.minus(Duration.ofHours(3)));
        jobRepository.save(orphaned);

        List<UUID> expired = jobStore.findExpired(10, Duration.ofHours(1)).stream().map(PrepressJob::getId).toList();

        assertTrue(expired.contains(expiredDone.getId()));
        assertTrue(expired.contains(orphaned.getId()));
        assertFalse(expired.contains(fresh.getId()));
        assertFalse(expired.contains(busy.getId()));
    }
}
