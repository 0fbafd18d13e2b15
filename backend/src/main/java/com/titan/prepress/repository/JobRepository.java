package com.titan.prepress.repository;

import com.titan.prepress.model.JobStatus;
import com.titan.prepress.model.PrepressJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<PrepressJob, UUID> {

    List<PrepressJob> findAllByOrderByCreatedAtDesc(Pageable page);

    List<PrepressJob> findByOrganizationIdOrderByCreatedAtDesc(String organizationId, Pageable page);

    @Query("SELECT j.id FROM PrepressJob j WHERE j.status = :status ORDER BY j.createdAt ASC")
    List<UUID> findIdsByStatusOldestFirst(@Param("status") JobStatus status, Pageable page);

    /**
     * Compare-and-set from queued to running. Returns 1 for the single caller that won the row.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PrepressJob j SET j.status = :running, j.startedAt = :now, j.progressMessage = :message "
            + "WHERE j.id = :id AND j.status = :queued")
    int claimIfQueued(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("message") String message,
                      @Param("queued") JobStatus queued,
                      @Param("running") JobStatus running);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PrepressJob j SET j.status = :cancelled, j.finishedAt = :now, j.progressMessage = :message "
            + "WHERE j.id = :id AND j.status = :queued")
    int cancelIfQueued(@Param("id") UUID id,
                       @Param("now") Instant now,
                       @Param("message") String message,
                       @Param("queued") JobStatus queued,
                       @Param("cancelled") JobStatus cancelled);

    @Transactional
    @Modifying
    @Query("UPDATE PrepressJob j SET j.progressMessage = :message WHERE j.id = :id AND j.status = :status")
    int updateProgress(@Param("id") UUID id, @Param("message") String message, @Param("status") JobStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM PrepressJob j WHERE j.id = :id")
    Optional<PrepressJob> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Expired rows, oldest expiry first. Running rows started after {@code runningCutoff}
     * are left alone so a live worker does not lose its directory.
     */
    @Query("SELECT j FROM PrepressJob j WHERE j.expiresAt < :now "
            + "AND (j.status <> :running OR j.startedAt IS NULL OR j.startedAt <= :runningCutoff) "
            + "ORDER BY j.expiresAt ASC")
    List<PrepressJob> findExpired(@Param("now") Instant now,
                                  @Param("running") JobStatus running,
                                  @Param("runningCutoff") Instant runningCutoff,
                                  Pageable page);
}
