package com.example.interviewreminder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Interview Reminder Service Application
 * <p>
 * Background pipeline that reminds candidates and interviewers of an upcoming
 * interview roughly one day before it starts.
 * <p>
 * Features:
 * - Hourly scheduler tick over a 23h-25h look-ahead window
 * - Durable job queue with idempotent enqueue by job key
 * - Bounded worker pool with exponential backoff retries
 * - Retention of finished jobs for inspection
 * - Slack alerting for jobs that exhaust their attempts
 */
@EnableScheduling
@SpringBootApplication
public class InterviewReminderApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewReminderApplication.class, args);
    }
}
