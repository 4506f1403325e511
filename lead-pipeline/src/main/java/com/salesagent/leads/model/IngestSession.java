package com.salesagent.leads.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One discovery batch and its write lifecycle.
 * Stored in the ingest_sessions table; frozen once COMPLETED or FAILED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestSession {

    private String sessionId;
    private SessionStatus status;
    private int requestedCount;
    private int insertedCount;
    private int updatedCount;
    private int verifiedCount;
    private int failedCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String lastError;       // null unless FAILED
}
