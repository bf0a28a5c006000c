package com.example.interviewreminder.audit;

/**
 * Append-only destination for reminder delivery history.
 */
public interface AuditSink {

    void record(AuditRecord record);
}
