package com.example.interviewreminder.domain.repository;

import com.example.interviewreminder.domain.entity.Interview;
import com.example.interviewreminder.domain.enums.InterviewStatus;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for interviews, restricted to what the reminder pipeline needs.
 */
@Repository
public interface InterviewRepository extends JpaRepository<Interview, String> {

    /**
     * Interviews with the given status, no reminder yet, starting inside [start, end].
     * Bounded by a query timeout so a slow store cannot stall the scheduler tick.
     */
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "30000"))
    @Query("""
            SELECT i FROM Interview i
            JOIN FETCH i.candidate
            JOIN FETCH i.interviewer
            WHERE i.status = :status
              AND i.reminderSent = false
              AND i.scheduledAt BETWEEN :start AND :end
            ORDER BY i.scheduledAt ASC
            """)
    List<Interview> findPendingReminders(@Param("status") InterviewStatus status,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end);

    @Query("""
            SELECT i FROM Interview i
            JOIN FETCH i.candidate
            JOIN FETCH i.interviewer
            WHERE i.id = :id
            """)
    Optional<Interview> findWithParticipantsById(@Param("id") String id);

    /**
     * Single-column idempotent update
     *
     * @return number of rows updated (0 if the interview no longer exists)
     */
    @Modifying
    @Query("UPDATE Interview i SET i.reminderSent = true WHERE i.id = :id")
    int markReminderSent(@Param("id") String id);
}
