package com.salesagent.leads.pipeline;

import com.salesagent.leads.client.CallRequest;
import com.salesagent.leads.client.CallingClient;
import com.salesagent.leads.client.ContentGenerator;
import com.salesagent.leads.client.GenerationRequest;
import com.salesagent.leads.client.GenerationResult;
import com.salesagent.leads.client.ProposalMailer;
import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.exception.StageException;
import com.salesagent.leads.model.BranchDecision;
import com.salesagent.leads.model.CallResult;
import com.salesagent.leads.model.Classification;
import com.salesagent.leads.model.Lead;
import com.salesagent.leads.model.PipelineRun;
import com.salesagent.leads.model.PipelineStage;
import com.salesagent.leads.model.StageStatus;
import com.salesagent.leads.service.IdempotencyGuard;
import com.salesagent.leads.service.PhoneNumbers;
import com.salesagent.leads.store.PipelineRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a single lead through RESEARCH → DRAFT → REVIEW → CALL → CLASSIFY → BRANCH → FINALIZE.
 *
 * Collaborator calls run on the stage executor under their own deadline, capped by what
 * is left of the per-lead budget. Stage bodies only return a value; the run and the
 * context are written by the lead's own thread once the result is in, so a body that
 * outlives its deadline cannot touch the stored run. BRANCH performs the side effect and
 * runs on the lead's thread without a cancellable deadline. A failed or timed-out stage
 * stops this lead only. FINALIZE always runs and always persists the run.
 */
@Component
@Slf4j
public class LeadPipelineRunner {

    static final String TIMEOUT = "timeout";

    private final ContentGenerator contentGenerator;
    private final CallingClient callingClient;
    private final ProposalMailer proposalMailer;
    private final IdempotencyGuard idempotencyGuard;
    private final PipelineRunRepository runRepository;
    private final PromptTemplates prompts;
    private final ClassificationParser classificationParser;
    private final LeadPipelineProperties properties;
    private final ExecutorService stageExecutor;

    private final List<StageDefinition> contentStages = List.of(
            new StageDefinition(PipelineStage.RESEARCH, PromptTemplates.RESEARCH,
                    ctx -> "", LeadContext::recordResearch),
            new StageDefinition(PipelineStage.DRAFT, PromptTemplates.DRAFT,
                    LeadContext::getResearch, LeadContext::recordDraft),
            new StageDefinition(PipelineStage.REVIEW, PromptTemplates.REVIEW,
                    LeadContext::getDraft, LeadContext::recordProposal));

    public LeadPipelineRunner(ContentGenerator contentGenerator,
                              CallingClient callingClient,
                              ProposalMailer proposalMailer,
                              IdempotencyGuard idempotencyGuard,
                              PipelineRunRepository runRepository,
                              PromptTemplates prompts,
                              ClassificationParser classificationParser,
                              LeadPipelineProperties properties,
                              @Qualifier("stageExecutor") ExecutorService stageExecutor) {
        this.contentGenerator = contentGenerator;
        this.callingClient = callingClient;
        this.proposalMailer = proposalMailer;
        this.idempotencyGuard = idempotencyGuard;
        this.runRepository = runRepository;
        this.prompts = prompts;
        this.classificationParser = classificationParser;
        this.properties = properties;
        this.stageExecutor = stageExecutor;
    }

    /**
     * Never throws. Whatever happens, the returned run is finalized and stored.
     */
    public PipelineRun run(String sessionId, Lead lead) {
        PipelineRun run = PipelineRun.start(sessionId, lead);
        LeadContext ctx = new LeadContext(lead, run);
        LeadPipelineProperties.Pipeline config = properties.getPipeline();
        long leadDeadline = System.nanoTime() + config.getLeadTimeout().toNanos();

        log.info("Pipeline started for lead {} ({})", lead.getName(), lead.getIdentityKey());
        try {
            for (StageDefinition definition : contentStages) {
                String text = runStage(run, definition.stage(), config.getStageTimeout(), leadDeadline,
                        generation(definition, ctx));
                definition.output().accept(ctx, text);
                run.mark(definition.stage(), StageStatus.SUCCEEDED);
            }

            CallRequest callRequest = callRequest(ctx);
            CallResult callResult = runStage(run, PipelineStage.CALL, config.getCallTimeout(), leadDeadline,
                    () -> callingClient.placeCall(callRequest));
            recordCall(ctx, callResult);

            GenerationRequest classifyRequest = classifyRequest(ctx);
            String verdict = runStage(run, PipelineStage.CLASSIFY, config.getStageTimeout(), leadDeadline,
                    () -> generate(PipelineStage.CLASSIFY, "classify", prompts.get(PromptTemplates.CLASSIFY),
                            classifyRequest));
            recordClassification(ctx, classificationParser.parse(verdict));

            branch(ctx, leadDeadline);

        } catch (StageException e) {
            run.setError(e.getMessage());
            log.error("Lead {} stopped at {}: {}", lead.getName(), e.getStage(), e.getMessage());
        } catch (RuntimeException e) {
            run.setError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            log.error("Lead {} stopped unexpectedly: {}", lead.getName(), e.getMessage(), e);
        } finally {
            finalizeRun(run);
        }
        return run;
    }

    // ── Stage execution ──────────────────────────────────────────────────────

    /**
     * Runs a side-effect free body under a deadline and hands back its value.
     * Only the calling thread writes to the run.
     */
    private <T> T runStage(PipelineRun run, PipelineStage stage, Duration stageTimeout, long leadDeadline,
                           Callable<T> body) {
        long remaining = leadDeadline - System.nanoTime();
        long budget = Math.min(stageTimeout.toNanos(), remaining);
        if (budget <= 0) {
            throw fail(run, stage, TIMEOUT, null);
        }

        run.mark(stage, StageStatus.RUNNING);
        log.debug("Lead {} entering {}", run.getLeadId(), stage);
        Future<T> future = stageExecutor.submit(body);
        try {
            return future.get(budget, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Lead {} timed out in {}", run.getLeadId(), stage);
            throw fail(run, stage, TIMEOUT, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageException stageException) {
                run.mark(stage, StageStatus.FAILED);
                throw stageException;
            }
            throw fail(run, stage, stage + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw fail(run, stage, "interrupted", null);
        }
    }

    private Callable<String> generation(StageDefinition definition, LeadContext ctx) {
        String stageName = definition.stage().name().toLowerCase(Locale.ROOT);
        GenerationRequest request = new GenerationRequest(definition.input().apply(ctx), ctx.describeLead());
        String instructions = prompts.get(definition.prompt());
        return () -> generate(definition.stage(), stageName, instructions, request);
    }

    private String generate(PipelineStage stage, String stageName, String instructions, GenerationRequest request) {
        GenerationResult result = contentGenerator.generate(stageName, instructions, request);
        if (!result.isSuccess()) {
            throw new StageException(stage,
                    stageName + " generation failed: " + (result.error() == null ? "empty output" : result.error()));
        }
        return result.text();
    }

    private CallRequest callRequest(LeadContext ctx) {
        Lead lead = ctx.getLead();
        String phone;
        try {
            phone = PhoneNumbers.toE164(lead.getPhone());
        } catch (IllegalArgumentException e) {
            throw fail(ctx.getRun(), PipelineStage.CALL, "cannot call lead: " + e.getMessage(), null);
        }

        String script = prompts.render(PromptTemplates.CALL_SCRIPT, Map.of(
                "name", lead.getName(),
                "category", lead.getCategory() == null ? "business" : lead.getCategory(),
                "address", lead.getAddress(),
                "proposal", ctx.getProposal() == null ? "" : ctx.getProposal()));
        return new CallRequest(phone, script, lead.getName());
    }

    private void recordCall(LeadContext ctx, CallResult result) {
        Lead lead = ctx.getLead();
        PipelineRun run = ctx.getRun();
        ctx.setCallResult(result);
        run.setCallOutcome(result.status());
        run.setCallId(result.callId());
        switch (result.status()) {
            case DONE -> run.setTranscript(result.transcriptText());
            case NO_ANSWER -> {
                log.info("Lead {} did not answer: {}", lead.getName(), result.error());
                run.setTranscript("");
            }
            default -> throw fail(run, PipelineStage.CALL,
                    "call " + result.status().name().toLowerCase(Locale.ROOT) + ": " + result.error(), null);
        }
        run.mark(PipelineStage.CALL, StageStatus.SUCCEEDED);
    }

    private GenerationRequest classifyRequest(LeadContext ctx) {
        CallResult call = ctx.getCallResult();
        String transcript = call == null ? "" : call.transcriptText();
        if (transcript.isEmpty() && call != null && call.error() != null) {
            transcript = "(no conversation: " + call.error() + ")";
        }
        return new GenerationRequest(transcript, ctx.describeLead());
    }

    private void recordClassification(LeadContext ctx, Classification classification) {
        ctx.setClassification(classification);
        PipelineRun run = ctx.getRun();
        run.setBranchDecision(classification.decision());
        run.setExtractedEmail(classification.email());
        run.setClassificationNote(classification.note());
        if (classification.ambiguous()) {
            log.warn("Lead {} classification ambiguous, treated as OTHER", ctx.getLead().getName());
        }
        log.info("Lead {} classified as {}", ctx.getLead().getName(), classification.decision().label());
        run.mark(PipelineStage.CLASSIFY, StageStatus.SUCCEEDED);
    }

    /**
     * Pure dispatch on the branch decision. Only AGREED_TO_EMAIL has a side effect, the
     * proposal email, sent at most once per lead. Every other outcome goes straight to FINALIZE.
     */
    private void branch(LeadContext ctx, long leadDeadline) {
        PipelineRun run = ctx.getRun();
        if (leadDeadline - System.nanoTime() <= 0) {
            throw fail(run, PipelineStage.BRANCH, TIMEOUT, null);
        }
        run.mark(PipelineStage.BRANCH, StageStatus.RUNNING);

        if (run.getBranchDecision() != BranchDecision.AGREED_TO_EMAIL) {
            run.mark(PipelineStage.BRANCH, StageStatus.SKIPPED);
            return;
        }

        Lead lead = ctx.getLead();
        String recipient = recipient(ctx);
        if (recipient == null) {
            run.setBranchNote("proposal email skipped: no recipient address");
            log.warn("Lead {} agreed to email but no address is known", lead.getName());
            run.mark(PipelineStage.BRANCH, StageStatus.SKIPPED);
            return;
        }

        Optional<String> messageId;
        try {
            messageId = idempotencyGuard.runOnce(IdempotencyGuard.SCOPE_PROPOSAL_EMAIL, lead.getIdentityKey(),
                    () -> proposalMailer.send(recipient, emailSubject(lead), emailBody(ctx)));
        } catch (RuntimeException e) {
            throw fail(run, PipelineStage.BRANCH, "proposal email failed: " + e.getMessage(), e);
        }
        if (messageId.isPresent()) {
            run.setEmailSent(true);
        } else {
            run.setBranchNote("proposal email already sent for this lead");
        }
        run.mark(PipelineStage.BRANCH, StageStatus.SUCCEEDED);
    }

    private void finalizeRun(PipelineRun run) {
        for (Map.Entry<PipelineStage, StageStatus> entry : run.getStageStatuses().entrySet()) {
            if (entry.getKey() != PipelineStage.FINALIZE && entry.getValue() == StageStatus.PENDING) {
                entry.setValue(StageStatus.SKIPPED);
            }
        }
        run.mark(PipelineStage.FINALIZE, StageStatus.SUCCEEDED);
        run.setCompletedAt(LocalDateTime.now());
        try {
            runRepository.save(run);
        } catch (RuntimeException e) {
            run.mark(PipelineStage.FINALIZE, StageStatus.FAILED);
            log.error("Could not persist run {} for lead {}: {}", run.getRunId(), run.getLeadId(), e.getMessage(), e);
        }
        if (run.isSuccessful()) {
            log.info("Pipeline finished for lead {}: decision={}, emailSent={}",
                    run.getLeadName(), run.getBranchDecision(), run.isEmailSent());
        } else {
            log.info("Pipeline finished with error for lead {}: {}", run.getLeadName(), run.getError());
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String recipient(LeadContext ctx) {
        String extracted = ctx.getRun().getExtractedEmail();
        if (extracted != null && !extracted.isBlank()) return extracted;
        return ctx.getLead().hasEmail() ? ctx.getLead().getEmail() : null;
    }

    private String emailSubject(Lead lead) {
        return properties.getMail().getSubject().replace("{name}", lead.getName());
    }

    private String emailBody(LeadContext ctx) {
        return prompts.render(PromptTemplates.PROPOSAL_EMAIL, Map.of(
                "name", ctx.getLead().getName(),
                "proposal", ctx.getProposal() == null ? "" : ctx.getProposal()));
    }

    private StageException fail(PipelineRun run, PipelineStage stage, String reason, Throwable cause) {
        run.mark(stage, StageStatus.FAILED);
        return cause == null ? new StageException(stage, reason) : new StageException(stage, reason, cause);
    }
}
