package com.example.interviewreminder.mapper;

import com.example.interviewreminder.domain.entity.ReminderJob;
import com.example.interviewreminder.dto.ManualReminderResponse;
import com.example.interviewreminder.dto.QueueStatsResponse;
import com.example.interviewreminder.dto.ReminderJobResponse;
import com.example.interviewreminder.service.queue.EnqueueResult;
import com.example.interviewreminder.service.queue.QueueStats;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.time.Instant;
import java.util.List;

/**
 * MapStruct mapper for converting queue types to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ReminderJobMapper {

    ReminderJobResponse toResponse(ReminderJob job);

    List<ReminderJobResponse> toResponseList(List<ReminderJob> jobs);

    QueueStatsResponse toResponse(QueueStats stats, Instant generatedAt);

    ManualReminderResponse.EnqueuedJob toEnqueuedJob(EnqueueResult result);

    List<ManualReminderResponse.EnqueuedJob> toEnqueuedJobs(List<EnqueueResult> results);
}
