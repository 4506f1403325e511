package com.salesagent.leads.config;

import com.salesagent.leads.model.IngestSession;
import com.salesagent.leads.model.InboundReply;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import com.salesagent.leads.model.ReplyOutcome;
import com.salesagent.leads.model.SearchRequest;
import com.salesagent.leads.output.LeadCsvExporter;
import com.salesagent.leads.pipeline.PipelineOrchestrator;
import com.salesagent.leads.pipeline.ReplyIntakeService;
import com.salesagent.leads.service.LeadDiscoveryService;
import com.salesagent.leads.service.LeadRetriever;
import com.salesagent.leads.store.PipelineRunRepository;
import com.salesagent.leads.store.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LeadPipelineController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final LeadDiscoveryService discoveryService;
    private final PipelineOrchestrator orchestrator;
    private final LeadRetriever retriever;
    private final SessionRepository sessionRepository;
    private final PipelineRunRepository runRepository;
    private final ReplyIntakeService replyIntakeService;
    private final LeadCsvExporter csvExporter;
    private final LeadPipelineProperties properties;

    // ── Triggers ─────────────────────────────────────────────────────────────

    /**
     * Start a discovery session.
     *
     * POST /sessions?query=coffee&location=Austin&radius=2000&limit=20
     */
    @PostMapping("/sessions")
    public ResponseEntity<Map<String, String>> discover(
            @RequestParam(defaultValue = "") String query,
            @RequestParam String location,
            @RequestParam(defaultValue = "2000") int radius,
            @RequestParam(defaultValue = "10") int limit) {
        SearchRequest request;
        try {
            request = new SearchRequest(query, location, radius, limit);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        String sessionId = LeadDiscoveryService.newSessionId();
        new Thread(() -> {
            try {
                discoveryService.discover(request, sessionId);
            } catch (Exception e) {
                log.error("Discovery for session {} failed: {}", sessionId, e.getMessage(), e);
            }
        }, "discover-" + sessionId).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "sessionId", sessionId));
    }

    @PostMapping("/sessions/{sessionId}/pipeline")
    public ResponseEntity<Map<String, String>> runPipeline(
            @PathVariable String sessionId,
            @RequestParam(required = false) Integer limit) {
        int effective = limit == null ? properties.getRetrieval().getDefaultLimit() : limit;
        if (effective <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        new Thread(() -> {
            try {
                orchestrator.runSession(sessionId, effective);
            } catch (Exception e) {
                log.error("Pipeline for session {} failed: {}", sessionId, e.getMessage(), e);
            }
        }, "pipeline-" + sessionId).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "sessionId", sessionId));
    }

    @PostMapping("/replies")
    public ResponseEntity<?> reply(@RequestBody InboundReply reply) {
        try {
            ReplyOutcome outcome = replyIntakeService.accept(reply);
            if (outcome.status() == ReplyOutcome.Status.DUPLICATE) {
                return ResponseEntity.ok(outcome);
            }
            return ResponseEntity.accepted().body(outcome);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Reply intake failed for {}: {}", reply.getMessageId(), e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "sales-agent-lead-pipeline",
                "version", "1.0.0",
                "fanOut", properties.getPipeline().getFanOut(),
                "schedulingEnabled", properties.getScheduling().isEnabled()
        ));
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    @GetMapping("/sessions")
    public ResponseEntity<List<IngestSession>> recentSessions(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(sessionRepository.findRecent(limit));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<?> session(@PathVariable String sessionId) {
        return sessionRepository.find(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "unknown session " + sessionId)));
    }

    /**
     * Leads for a session, using the retrieval cascade.
     *
     * GET /sessions/{id}/leads?limit=10
     */
    @GetMapping("/sessions/{sessionId}/leads")
    public ResponseEntity<?> leads(@PathVariable String sessionId,
                                   @RequestParam(required = false) Integer limit) {
        try {
            return ResponseEntity.ok(fetch(sessionId, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Lead query failed for session {}: {}", sessionId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/sessions/{sessionId}/runs")
    public ResponseEntity<?> runs(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(runRepository.findBySession(sessionId));
        } catch (Exception e) {
            log.error("Run query failed for session {}: {}", sessionId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Export ───────────────────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}/export")
    public ResponseEntity<?> exportLeads(@PathVariable String sessionId,
                                         @RequestParam(required = false) Integer limit) {
        try {
            List<Lead> leads = fetch(sessionId, limit);
            return csv("leads_" + sessionId + ".csv", csvExporter.leadsToCsv(leads));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Lead export failed for session {}: {}", sessionId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/sessions/{sessionId}/runs/export")
    public ResponseEntity<?> exportRuns(@PathVariable String sessionId) {
        try {
            List<PipelineRun> runs = runRepository.findBySession(sessionId);
            return csv("runs_" + sessionId + ".csv", csvExporter.runsToCsv(runs));
        } catch (Exception e) {
            log.error("Run export failed for session {}: {}", sessionId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private List<Lead> fetch(String sessionId, Integer limit) {
        int effective = limit == null ? properties.getRetrieval().getDefaultLimit() : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return retriever.fetchSessionLeads(sessionId, effective);
    }

    private ResponseEntity<String> csv(String filename, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }
}
