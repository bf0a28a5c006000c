package com.example.interviewreminder.controller;

import com.example.interviewreminder.domain.enums.JobState;
import com.example.interviewreminder.dto.ApiResponse;
import com.example.interviewreminder.dto.ManualReminderResponse;
import com.example.interviewreminder.dto.QueueStatsResponse;
import com.example.interviewreminder.dto.ReminderJobResponse;
import com.example.interviewreminder.mapper.ReminderJobMapper;
import com.example.interviewreminder.service.ReminderMonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for monitoring the reminder queue and triggering manual reminders.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/reminders")
@Tag(name = "Interview Reminders", description = "Queue monitoring and manual reminder APIs")
public class ReminderController {

    private final ReminderMonitoringService monitoringService;
    private final ReminderJobMapper jobMapper;
    private final Clock clock;

    @GetMapping("/queue/stats")
    @Operation(summary = "Get queue statistics", description = "Job counts per state")
    public ResponseEntity<ApiResponse<QueueStatsResponse>> getQueueStats() {
        var stats = jobMapper.toResponse(monitoringService.getStats(), clock.instant());
        return ResponseEntity.ok(ApiResponse.success(stats));
    }

    @PostMapping("/interviews/{interviewId}/send")
    @Operation(summary = "Send a manual reminder", description = "Remind both participants of an interview now, even if a reminder was already sent")
    public ResponseEntity<ApiResponse<ManualReminderResponse>> sendManualReminder(
            @Parameter(description = "Interview ID") @PathVariable String interviewId) {
        log.info("Manual reminder requested for interview {}", interviewId);

        var results = monitoringService.sendManualReminder(interviewId);
        var response = ManualReminderResponse.builder()
                .interviewId(interviewId)
                .jobs(jobMapper.toEnqueuedJobs(results))
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Manual reminder scheduled"));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a reminder job by its unique identifier")
    public ResponseEntity<ApiResponse<ReminderJobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getJob(jobId)));
    }

    @GetMapping("/jobs")
    @Operation(summary = "List jobs by state", description = "Page through jobs in one state, newest first")
    public ResponseEntity<ApiResponse<Page<ReminderJobResponse>>> getJobsByState(
            @Parameter(description = "Job state") @RequestParam JobState state,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        var pageable = PageRequest.of(page, Math.min(size, 100), Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getJobsByState(state, pageable)));
    }

    @GetMapping("/interviews/{interviewId}/jobs")
    @Operation(summary = "Get jobs of an interview", description = "All retained reminder jobs of an interview")
    public ResponseEntity<ApiResponse<List<ReminderJobResponse>>> getJobsForInterview(
            @Parameter(description = "Interview ID") @PathVariable String interviewId) {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getJobsForInterview(interviewId)));
    }
}
