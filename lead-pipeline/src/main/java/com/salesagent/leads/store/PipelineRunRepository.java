package com.salesagent.leads.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.model.BranchDecision;
import com.salesagent.leads.model.CallStatus;
import com.salesagent.leads.model.PipelineRun;
import com.salesagent.leads.model.PipelineStage;
import com.salesagent.leads.model.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.salesagent.leads.store.JdbcLeadStore.toLocal;
import static com.salesagent.leads.store.JdbcLeadStore.ts;

/**
 * Audit rows for pipeline runs. Owned by the orchestrator; one row per run id.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PipelineRunRepository {

    private static final TypeReference<Map<PipelineStage, StageStatus>> STAGE_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void save(PipelineRun run) {
        String stageStatuses = writeStageStatuses(run.getStageStatuses());
        int updated = jdbcTemplate.update("""
                UPDATE pipeline_runs
                SET stage = ?, stage_status = ?, stage_statuses = ?, branch_decision = ?, call_outcome = ?,
                    call_id = ?, classification_note = ?, extracted_email = ?,
                    email_sent = ?, branch_note = ?, research = ?, draft = ?, proposal = ?, transcript = ?,
                    completed_at = ?, error = ?
                WHERE run_id = ?
                """,
                run.getStage().name(),
                run.getStageStatus().name(),
                stageStatuses,
                name(run.getBranchDecision()),
                name(run.getCallOutcome()),
                run.getCallId(),
                run.getClassificationNote(),
                run.getExtractedEmail(),
                run.isEmailSent(),
                run.getBranchNote(),
                run.getResearch(),
                run.getDraft(),
                run.getProposal(),
                run.getTranscript(),
                ts(run.getCompletedAt()),
                run.getError(),
                run.getRunId());
        if (updated > 0) {
            return;
        }
        jdbcTemplate.update("""
                INSERT INTO pipeline_runs
                (run_id, session_id, lead_id, lead_name, stage, stage_status, stage_statuses, branch_decision,
                 call_outcome, call_id, classification_note, extracted_email, email_sent,
                 branch_note, research, draft, proposal, transcript, started_at, completed_at, error)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(),
                run.getSessionId(),
                run.getLeadId(),
                run.getLeadName(),
                run.getStage().name(),
                run.getStageStatus().name(),
                stageStatuses,
                name(run.getBranchDecision()),
                name(run.getCallOutcome()),
                run.getCallId(),
                run.getClassificationNote(),
                run.getExtractedEmail(),
                run.isEmailSent(),
                run.getBranchNote(),
                run.getResearch(),
                run.getDraft(),
                run.getProposal(),
                run.getTranscript(),
                ts(run.getStartedAt()),
                ts(run.getCompletedAt()),
                run.getError());
        log.debug("Pipeline run {} stored for lead {}", run.getRunId(), run.getLeadId());
    }

    public List<PipelineRun> findBySession(String sessionId) {
        return jdbcTemplate.query(
                "SELECT * FROM pipeline_runs WHERE session_id = ? ORDER BY started_at, run_id",
                this::mapRun, sessionId);
    }

    public List<PipelineRun> findByLead(String leadId) {
        return jdbcTemplate.query(
                "SELECT * FROM pipeline_runs WHERE lead_id = ? ORDER BY started_at, run_id",
                this::mapRun, leadId);
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private PipelineRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        PipelineRun run = new PipelineRun();
        run.setRunId(rs.getString("run_id"));
        run.setSessionId(rs.getString("session_id"));
        run.setLeadId(rs.getString("lead_id"));
        run.setLeadName(rs.getString("lead_name"));
        run.setStage(PipelineStage.valueOf(rs.getString("stage")));
        run.setStageStatus(StageStatus.valueOf(rs.getString("stage_status")));
        run.setStageStatuses(readStageStatuses(rs.getString("stage_statuses")));
        String decision = rs.getString("branch_decision");
        if (decision != null) {
            run.setBranchDecision(BranchDecision.valueOf(decision));
        }
        String outcome = rs.getString("call_outcome");
        run.setCallOutcome(outcome == null ? null : CallStatus.valueOf(outcome));
        run.setCallId(rs.getString("call_id"));
        run.setClassificationNote(rs.getString("classification_note"));
        run.setExtractedEmail(rs.getString("extracted_email"));
        run.setEmailSent(rs.getBoolean("email_sent"));
        run.setBranchNote(rs.getString("branch_note"));
        run.setResearch(rs.getString("research"));
        run.setDraft(rs.getString("draft"));
        run.setProposal(rs.getString("proposal"));
        run.setTranscript(rs.getString("transcript"));
        run.setStartedAt(toLocal(rs.getTimestamp("started_at")));
        run.setCompletedAt(toLocal(rs.getTimestamp("completed_at")));
        run.setError(rs.getString("error"));
        return run;
    }

    private String writeStageStatuses(Map<PipelineStage, StageStatus> statuses) {
        try {
            return objectMapper.writeValueAsString(statuses);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise stage statuses", e);
        }
    }

    private Map<PipelineStage, StageStatus> readStageStatuses(String json) {
        Map<PipelineStage, StageStatus> result = new EnumMap<>(PipelineStage.class);
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            result.putAll(objectMapper.readValue(json, STAGE_MAP));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable stage statuses '{}': {}", json, e.getMessage());
        }
        return result;
    }

    private static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }
}
