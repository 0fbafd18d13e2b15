package com.titan.prepress.repository;

import com.titan.prepress.model.PrepressFinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FindingRepository extends JpaRepository<PrepressFinding, UUID> {

    List<PrepressFinding> findByJobIdAndOrganizationIdOrderByCreatedAtAsc(UUID jobId, String organizationId);

    @Modifying
    @Query("DELETE FROM PrepressFinding f WHERE f.jobId = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
