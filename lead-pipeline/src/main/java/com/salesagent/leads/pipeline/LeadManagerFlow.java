package com.salesagent.leads.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.client.ContentGenerator;
import com.salesagent.leads.client.GenerationRequest;
import com.salesagent.leads.client.GenerationResult;
import com.salesagent.leads.client.MeetingScheduler;
import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.InboundReply;
import com.salesagent.leads.model.Meeting;
import com.salesagent.leads.model.ReplyAnalysis;
import com.salesagent.leads.model.ReplyOutcome;
import com.salesagent.leads.service.IdempotencyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Handles a prospect's email reply: screen out automated mail, decide whether the
 * sender is a hot lead asking for a meeting, and book one if both hold.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LeadManagerFlow {

    static final double HOT_LEAD_THRESHOLD = 0.6;

    private static final List<String> AUTOMATED_SENDERS = List.of(
            "noreply", "no-reply", "no_reply", "donotreply", "do-not-reply",
            "notification", "notifications", "mailer-daemon", "postmaster", "alerts", "newsletter");

    private static final List<String> AUTOMATED_SUBJECTS = List.of(
            "verify", "verification", "password", "billing", "invoice", "receipt",
            "security alert", "unsubscribe", "delivery status");

    private static final List<String> HOT_LEAD_KEYWORDS = List.of(
            "interested", "partnership", "collaboration", "services", "discuss",
            "meeting", "demo", "consultation", "opportunity", "proposal",
            "quotation", "pricing", "solution", "implementation", "project",
            "contract", "business", "company", "help", "support", "assistance",
            "consulting", "development", "design", "marketing", "sales");

    private static final List<String> URGENCY_KEYWORDS = List.of(
            "urgent", "asap", "immediately", "soon", "rapid", "quick",
            "priority", "important", "deadline", "timeline", "schedule");

    private static final List<String> MEETING_KEYWORDS = List.of(
            "meet", "meeting", "schedule", "call", "appointment", "session",
            "discuss", "talk", "chat", "conversation", "demo", "presentation");

    private static final List<String> PERSONAL_DOMAINS = List.of("gmail", "yahoo", "hotmail");

    private final ContentGenerator contentGenerator;
    private final MeetingScheduler meetingScheduler;
    private final IdempotencyGuard idempotencyGuard;
    private final PromptTemplates prompts;
    private final ObjectMapper objectMapper;
    private final LeadPipelineProperties properties;

    public ReplyOutcome process(InboundReply reply) {
        String skipReason = automatedReason(reply);
        if (skipReason != null) {
            log.info("Reply {} from {} skipped: {}", reply.getMessageId(), reply.getSenderEmail(), skipReason);
            return ReplyOutcome.skipped(reply.getMessageId(), skipReason);
        }

        ReplyAnalysis analysis = analyze(reply);
        log.info("Reply {} from {}: hotLead={}, meetingRequest={}, confidence={}{}",
                reply.getMessageId(), reply.getSenderEmail(), analysis.hotLead(), analysis.meetingRequest(),
                analysis.confidence(), analysis.fallbackUsed() ? " (keyword fallback)" : "");

        if (!MeetingQualifier.shouldSchedule(analysis.hotLead(), analysis.meetingRequest())) {
            return new ReplyOutcome(reply.getMessageId(), ReplyOutcome.Status.PROCESSED,
                    analysis.hotLead(), analysis.meetingRequest(), null, "no meeting needed");
        }

        String sender = reply.getSenderEmail().trim().toLowerCase(Locale.ROOT);
        String who = reply.getSenderName() == null || reply.getSenderName().isBlank() ? sender : reply.getSenderName();
        String title = properties.getMeeting().getTitleTemplate().replace("{name}", who);
        try {
            Optional<Meeting> meeting = idempotencyGuard.runOnce(IdempotencyGuard.SCOPE_MEETING, sender,
                    () -> meetingScheduler.schedule(sender, sender, title));
            String meetingId = meeting.map(Meeting::getMeetingId).orElse(null);
            String reason = meeting.isPresent() ? "meeting scheduled" : "meeting already scheduled for sender";
            return new ReplyOutcome(reply.getMessageId(), ReplyOutcome.Status.PROCESSED,
                    true, true, meetingId, reason);
        } catch (RuntimeException e) {
            log.error("Scheduling meeting for reply {} failed: {}", reply.getMessageId(), e.getMessage(), e);
            return new ReplyOutcome(reply.getMessageId(), ReplyOutcome.Status.FAILED,
                    true, true, null, "scheduling failed: " + e.getMessage());
        }
    }

    // ── Screening ────────────────────────────────────────────────────────────

    String automatedReason(InboundReply reply) {
        String sender = reply.getSenderEmail() == null ? "" : reply.getSenderEmail().toLowerCase(Locale.ROOT);
        if (sender.isBlank() || !sender.contains("@")) {
            return "missing sender address";
        }
        String local = sender.substring(0, sender.indexOf('@'));
        for (String prefix : AUTOMATED_SENDERS) {
            if (local.startsWith(prefix)) return "automated sender " + sender;
        }
        String subject = reply.getSubject() == null ? "" : reply.getSubject().toLowerCase(Locale.ROOT);
        for (String keyword : AUTOMATED_SUBJECTS) {
            if (subject.contains(keyword)) return "automated subject (" + keyword + ")";
        }
        return null;
    }

    // ── Analysis ─────────────────────────────────────────────────────────────

    ReplyAnalysis analyze(InboundReply reply) {
        String text = "From: " + reply.getSenderEmail() + "\nSubject: " + nullToEmpty(reply.getSubject())
                + "\n\n" + nullToEmpty(reply.getBody());
        GenerationResult result = contentGenerator.generate("reply-analysis",
                prompts.get(PromptTemplates.REPLY_ANALYSIS), new GenerationRequest(text, ""));
        if (result.isSuccess()) {
            Optional<JsonNode> json = JsonReplies.extractObject(objectMapper, result.text());
            if (json.isPresent() && json.get().has("is_hot_lead")) {
                JsonNode node = json.get();
                double confidence = node.path("confidence").asDouble(0.0);
                boolean hot = JsonReplies.bool(node.path("is_hot_lead")) || confidence >= HOT_LEAD_THRESHOLD;
                return new ReplyAnalysis(hot, JsonReplies.bool(node.path("is_meeting_request")),
                        confidence, node.path("note").asText(null), false);
            }
            log.warn("Reply analysis unusable, falling back to keywords: {}", JsonReplies.abbreviate(result.text()));
        } else {
            log.warn("Reply analysis failed ({}), falling back to keywords", result.error());
        }
        return keywordAnalysis(reply);
    }

    /** Scores keyword hits when the model cannot be used. */
    ReplyAnalysis keywordAnalysis(InboundReply reply) {
        String text = (nullToEmpty(reply.getSubject()) + " " + nullToEmpty(reply.getBody())).toLowerCase(Locale.ROOT);

        int score = 0;
        for (String keyword : HOT_LEAD_KEYWORDS) {
            if (text.contains(keyword)) score += 2;
        }
        for (String keyword : URGENCY_KEYWORDS) {
            if (text.contains(keyword)) score += 3;
        }
        String sender = nullToEmpty(reply.getSenderEmail()).toLowerCase(Locale.ROOT);
        String domain = sender.contains("@") ? sender.substring(sender.indexOf('@') + 1) : "";
        if (PERSONAL_DOMAINS.stream().noneMatch(domain::contains)) {
            score += 5;
        }

        long meetingHits = MEETING_KEYWORDS.stream().filter(text::contains).count();
        boolean hot = score >= 10;
        boolean meeting = meetingHits >= 2;
        double confidence = Math.min(score / 20.0, 1.0);
        return new ReplyAnalysis(hot, meeting, confidence, "keyword score " + score, true);
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
