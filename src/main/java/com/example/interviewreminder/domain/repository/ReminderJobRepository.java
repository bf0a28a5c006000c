package com.example.interviewreminder.domain.repository;

import com.example.interviewreminder.domain.entity.ReminderJob;
import com.example.interviewreminder.domain.enums.JobState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the reminder job queue.
 * <p>
 * Uses PostgreSQL-specific features for distributed job acquisition:
 * - FOR UPDATE SKIP LOCKED for row-level locking
 * - Optimistic locking with version field
 * - A unique index on active_key for atomic enqueue deduplication
 */
@Repository
public interface ReminderJobRepository extends JpaRepository<ReminderJob, UUID> {

    /**
     * Find jobs ready to be claimed.
     * <p>
     * Criteria:
     * - State is WAITING or DELAYED
     * - Available time has passed (backoff elapsed)
     * - Not currently locked OR lock has expired
     * <p>
     * Oldest available first.
     */
    @Query(value = """
            SELECT j.* FROM reminder_jobs j
            WHERE j.state IN ('WAITING', 'DELAYED')
              AND j.available_at <= :now
              AND (j.locked_by IS NULL OR j.locked_until < :now)
            ORDER BY j.available_at ASC, j.created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<ReminderJob> findJobsReadyForClaim(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Claim a job for processing.
     *
     * @return number of rows updated (1 if claimed, 0 if another worker got it first)
     */
    @Modifying
    @Query("""
            UPDATE ReminderJob j
            SET j.lockedBy = :instanceId,
                j.lockedUntil = :lockUntil,
                j.state = :activeState,
                j.startedAt = :now,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id = :jobId
              AND j.version = :version
              AND j.state IN :claimableStates
              AND (j.lockedBy IS NULL OR j.lockedUntil < :now)
            """)
    int claimJob(
            @Param("jobId") UUID jobId,
            @Param("instanceId") String instanceId,
            @Param("lockUntil") Instant lockUntil,
            @Param("version") Long version,
            @Param("now") Instant now,
            @Param("activeState") JobState activeState,
            @Param("claimableStates") List<JobState> claimableStates);

    /**
     * Find the pending job currently holding a key
     */
    Optional<ReminderJob> findByActiveKey(String activeKey);

    /**
     * Find active jobs whose lock expired; their worker died or hung
     */
    @Query("""
            SELECT j FROM ReminderJob j
            WHERE j.state = :activeState
              AND j.lockedUntil < :now
            """)
    List<ReminderJob> findStalledJobs(@Param("now") Instant now, @Param("activeState") JobState activeState);

    /**
     * Put stalled jobs back to WAITING without consuming an attempt
     */
    @Modifying
    @Query("""
            UPDATE ReminderJob j
            SET j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.state = :waitingState,
                j.lastError = 'Job stalled: worker lock expired before completion',
                j.availableAt = :now,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id IN :jobIds
            """)
    int resetStalledJobs(@Param("jobIds") List<UUID> jobIds, @Param("now") Instant now, @Param("waitingState") JobState waitingState);

    /**
     * Hand claimed but unstarted jobs back to WAITING, keeping their attempt count
     */
    @Modifying
    @Query("""
            UPDATE ReminderJob j
            SET j.lockedBy = NULL,
                j.lockedUntil = NULL,
                j.state = :waitingState,
                j.startedAt = NULL,
                j.updatedAt = :now,
                j.version = j.version + 1
            WHERE j.id IN :jobIds
              AND j.state = :activeState
              AND j.lockedBy = :instanceId
            """)
    int releaseClaimedJobs(
            @Param("jobIds") List<UUID> jobIds,
            @Param("instanceId") String instanceId,
            @Param("now") Instant now,
            @Param("activeState") JobState activeState,
            @Param("waitingState") JobState waitingState);

    /**
     * Ids of terminal jobs beyond the newest {@code keep}, oldest last
     */
    @Query(value = """
            SELECT j.id FROM reminder_jobs j
            WHERE j.state = :state
            ORDER BY j.finished_at DESC, j.created_at DESC
            OFFSET :keep
            """, nativeQuery = true)
    List<UUID> findJobIdsBeyondRetention(@Param("state") String state, @Param("keep") int keep);

    List<ReminderJob> findByInterviewIdOrderByCreatedAtDesc(String interviewId);

    Page<ReminderJob> findByState(JobState state, Pageable pageable);

    long countByState(JobState state);

    /**
     * Job counts grouped by state
     */
    @Query("""
            SELECT j.state as state, COUNT(j) as count
            FROM ReminderJob j
            GROUP BY j.state
            """)
    List<Object[]> countJobsGroupedByState();
}
