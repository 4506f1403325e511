package com.salesagent.leads.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one lead's trip through the pipeline.
 * Stored in the pipeline_runs table by the FINALIZE stage, whatever the outcome.
 */
@Data
@NoArgsConstructor
public class PipelineRun {

    private String runId;           // UUID
    private String sessionId;
    private String leadId;          // identity key of the lead
    private String leadName;

    // ── Progress ────────────────────────────────────────────────────────────
    private PipelineStage stage;
    private StageStatus stageStatus;
    private Map<PipelineStage, StageStatus> stageStatuses = new EnumMap<>(PipelineStage.class);

    // ── Outcome ─────────────────────────────────────────────────────────────
    private BranchDecision branchDecision;
    private CallStatus callOutcome;
    private String callId;
    private String classificationNote;
    private String extractedEmail;
    private boolean emailSent;
    private String branchNote;      // why a side effect was skipped or not repeated

    // ── Stage output kept for audit ─────────────────────────────────────────
    private String research;
    private String draft;
    private String proposal;
    private String transcript;

    // ── Timing ──────────────────────────────────────────────────────────────
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String error;           // null when the run finished cleanly

    public static PipelineRun start(String sessionId, Lead lead) {
        PipelineRun run = new PipelineRun();
        run.setRunId(UUID.randomUUID().toString());
        run.setSessionId(sessionId);
        run.setLeadId(lead.getIdentityKey());
        run.setLeadName(lead.getName());
        run.setStartedAt(LocalDateTime.now());
        for (PipelineStage s : PipelineStage.values()) {
            run.stageStatuses.put(s, StageStatus.PENDING);
        }
        run.setStage(PipelineStage.RESEARCH);
        run.setStageStatus(StageStatus.PENDING);
        return run;
    }

    /**
     * Branch decision is written once, by CLASSIFY. Later stages only read it.
     *
     * @throws IllegalStateException on a second assignment
     */
    public void setBranchDecision(BranchDecision decision) {
        if (this.branchDecision != null) {
            throw new IllegalStateException("branch decision already set to " + this.branchDecision
                    + " for lead " + leadId);
        }
        this.branchDecision = decision;
    }

    public void mark(PipelineStage stage, StageStatus status) {
        this.stage = stage;
        this.stageStatus = status;
        this.stageStatuses.put(stage, status);
    }

    public boolean isSuccessful() {
        return error == null;
    }
}
