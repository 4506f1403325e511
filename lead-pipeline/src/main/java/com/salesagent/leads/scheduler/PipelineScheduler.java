package com.salesagent.leads.scheduler;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.DiscoveryResult;
import com.salesagent.leads.model.SearchRequest;
import com.salesagent.leads.model.SessionStatus;
import com.salesagent.leads.pipeline.PipelineOrchestrator;
import com.salesagent.leads.service.LeadDiscoveryService;
import com.salesagent.leads.store.StoreSchema;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Schema bootstrap plus the periodic discover-then-outreach cycle.
 *
 * Default schedule: weekdays at 09:00 UTC, only when lead-pipeline.scheduling.enabled=true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final StoreSchema storeSchema;
    private final LeadDiscoveryService discoveryService;
    private final PipelineOrchestrator orchestrator;
    private final LeadPipelineProperties properties;

    @PostConstruct
    public void onStartup() {
        try {
            storeSchema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise lead store schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup enabled, running one cycle now");
            runCycle();
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Lead pipeline ready. Scheduled cycle: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${lead-pipeline.scheduling.cron:0 0 9 * * MON-FRI}", zone = "UTC")
    public void scheduledCycle() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled cycle triggered");
        runCycle();
    }

    void runCycle() {
        LeadPipelineProperties.Scheduling cfg = properties.getScheduling();
        try {
            DiscoveryResult result = discoveryService.discover(
                    new SearchRequest(cfg.getQuery(), cfg.getLocation(), cfg.getRadiusMeters(), cfg.getLimit()));
            if (result.report().getStatus() != SessionStatus.COMPLETED) {
                log.warn("Session {} ended {}, skipping pipeline", result.sessionId(), result.report().getStatus());
                return;
            }
            orchestrator.runSession(result.sessionId(), cfg.getLimit());
        } catch (Exception e) {
            log.error("Scheduled cycle failed: {}", e.getMessage(), e);
        }
    }
}
