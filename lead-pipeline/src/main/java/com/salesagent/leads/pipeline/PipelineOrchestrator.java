package com.salesagent.leads.pipeline;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.exception.VerificationTimeoutException;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import com.salesagent.leads.model.VerificationResult;
import com.salesagent.leads.service.LeadRetriever;
import com.salesagent.leads.service.WriteVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the outreach pipeline for every lead of a verified session.
 *
 * Leads fan out over the fixed-size pipeline executor; each lead is isolated, so one
 * lead failing or timing out never affects its siblings.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    private final WriteVerifier verifier;
    private final LeadRetriever retriever;
    private final LeadPipelineRunner runner;
    private final LeadPipelineProperties properties;
    private final ExecutorService pipelineExecutor;

    public PipelineOrchestrator(WriteVerifier verifier,
                                LeadRetriever retriever,
                                LeadPipelineRunner runner,
                                LeadPipelineProperties properties,
                                @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.verifier = verifier;
        this.retriever = retriever;
        this.runner = runner;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Verify, retrieve, then run every lead.
     *
     * @throws VerificationTimeoutException if the session is not ready and
     *                                      {@code lead-pipeline.pipeline.proceed-on-unverified} is false
     */
    public List<PipelineRun> runSession(String sessionId, int limit) {
        VerificationResult verification = verifier.waitForSessionReady(sessionId);
        if (!verification.ready()) {
            if (!properties.getPipeline().isProceedOnUnverified()) {
                throw new VerificationTimeoutException(sessionId, verification);
            }
            log.warn("Session {} not verified (status={}), proceeding anyway", sessionId, verification.status());
        }

        List<Lead> leads = retriever.fetchSessionLeads(sessionId, limit);
        long foreign = leads.stream().filter(l -> !sessionId.equals(l.getSessionId())).count();
        if (foreign > 0) {
            log.warn("Session {}: {} of {} lead(s) come from the recent-leads fallback", sessionId, foreign, leads.size());
        }
        return runLeads(sessionId, leads);
    }

    public List<PipelineRun> runLeads(String sessionId, List<Lead> leads) {
        log.info("Session {}: running pipeline for {} lead(s), fan-out {}",
                sessionId, leads.size(), properties.getPipeline().getFanOut());

        List<Future<PipelineRun>> futures = new ArrayList<>();
        for (Lead lead : leads) {
            futures.add(pipelineExecutor.submit(() -> runner.run(sessionId, lead)));
        }

        List<PipelineRun> runs = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                runs.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Pipeline worker for lead {} crashed: {}",
                        leads.get(i).getIdentityKey(), e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Session {} interrupted, cancelling {} outstanding lead(s)", sessionId, futures.size() - i);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            }
        }

        long failed = runs.stream().filter(r -> !r.isSuccessful()).count();
        log.info("Session {}: pipeline finished, {} run(s), {} with error", sessionId, runs.size(), failed);
        return runs;
    }
}
