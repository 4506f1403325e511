package com.salesagent.leads.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.TestDatabase;
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
import com.salesagent.leads.store.ProcessedKeyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LeadManagerFlowTest {

    @Mock
    private ContentGenerator contentGenerator;

    @Mock
    private MeetingScheduler meetingScheduler;

    private LeadManagerFlow flow;

    @BeforeEach
    void setUp() {
        IdempotencyGuard guard = new IdempotencyGuard(new ProcessedKeyRepository(TestDatabase.create()));
        flow = new LeadManagerFlow(contentGenerator, meetingScheduler, guard, new PromptTemplates(),
            new ObjectMapper(), new LeadPipelineProperties());
    }

    @Test
    void automatedSendersAreSkippedWithoutAnalysis() {
        ReplyOutcome outcome = flow.process(reply("m1", "no-reply@shop.example", "Your order", "thanks"));

        assertThat(outcome.status()).isEqualTo(ReplyOutcome.Status.SKIPPED);
        verifyNoInteractions(contentGenerator, meetingScheduler);
    }

    @Test
    void transactionalSubjectsAreSkipped() {
        ReplyOutcome outcome = flow.process(reply("m1", "anna@bakery.example", "Your invoice #123", "attached"));

        assertThat(outcome.status()).isEqualTo(ReplyOutcome.Status.SKIPPED);
        assertThat(outcome.reason()).contains("invoice");
    }

    @Test
    void hotLeadAskingToMeetGetsMeeting() {
        analysisReturns("{\"is_hot_lead\": true, \"is_meeting_request\": true, \"confidence\": 0.9}");
        when(meetingScheduler.schedule(eq("anna@bakery.example"), eq("anna@bakery.example"), anyString()))
            .thenReturn(Meeting.builder().meetingId("m-1").build());

        ReplyOutcome outcome = flow.process(reply("m1", "Anna@Bakery.example", "Re: proposal", "Can we talk Tuesday?"));

        assertThat(outcome.status()).isEqualTo(ReplyOutcome.Status.PROCESSED);
        assertThat(outcome.meetingId()).isEqualTo("m-1");
    }

    @Test
    void meetingRequestFromColdLeadIsNotScheduled() {
        analysisReturns("{\"is_hot_lead\": false, \"is_meeting_request\": true, \"confidence\": 0.2}");

        ReplyOutcome outcome = flow.process(reply("m1", "anna@bakery.example", "Re: proposal", "maybe a chat"));

        assertThat(outcome.status()).isEqualTo(ReplyOutcome.Status.PROCESSED);
        assertThat(outcome.meetingId()).isNull();
        verify(meetingScheduler, never()).schedule(anyString(), anyString(), anyString());
    }

    @Test
    void secondReplyFromSameSenderDoesNotBookAgain() {
        analysisReturns("{\"is_hot_lead\": true, \"is_meeting_request\": true, \"confidence\": 0.9}");
        when(meetingScheduler.schedule(anyString(), anyString(), anyString()))
            .thenReturn(Meeting.builder().meetingId("m-1").build());

        flow.process(reply("m1", "anna@bakery.example", "Re: proposal", "let's meet"));
        ReplyOutcome second = flow.process(reply("m2", "anna@bakery.example", "Re: proposal", "let's meet"));

        assertThat(second.status()).isEqualTo(ReplyOutcome.Status.PROCESSED);
        assertThat(second.meetingId()).isNull();
        assertThat(second.reason()).contains("already scheduled");
        verify(meetingScheduler, times(1)).schedule(anyString(), anyString(), anyString());
    }

    @Test
    void schedulingErrorIsReportedAsFailed() {
        analysisReturns("{\"is_hot_lead\": true, \"is_meeting_request\": true}");
        when(meetingScheduler.schedule(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("calendar down"));

        ReplyOutcome outcome = flow.process(reply("m1", "anna@bakery.example", "Re: proposal", "let's meet"));

        assertThat(outcome.status()).isEqualTo(ReplyOutcome.Status.FAILED);
        assertThat(outcome.reason()).contains("calendar down");
    }

    @Test
    void unusableModelReplyFallsBackToKeywords() {
        analysisReturns("I think they are keen.");

        ReplyAnalysis analysis = flow.analyze(reply("m1", "ceo@acme-logistics.example", "Partnership proposal",
            "We are interested in your services and would like to schedule a meeting to discuss pricing asap."));

        assertThat(analysis.fallbackUsed()).isTrue();
        assertThat(analysis.hotLead()).isTrue();
        assertThat(analysis.meetingRequest()).isTrue();
        assertThat(analysis.confidence()).isEqualTo(1.0);
    }

    @Test
    void keywordFallbackIgnoresPlainPersonalMail() {
        ReplyAnalysis analysis = flow.keywordAnalysis(
            reply("m1", "sam@gmail.com", "Re: hello", "Thanks, not right now."));

        assertThat(analysis.hotLead()).isFalse();
        assertThat(analysis.meetingRequest()).isFalse();
        assertThat(analysis.confidence()).isZero();
    }

    @Test
    void failedGenerationAlsoFallsBack() {
        when(contentGenerator.generate(eq("reply-analysis"), anyString(), any(GenerationRequest.class)))
            .thenReturn(GenerationResult.failed("503"));

        ReplyAnalysis analysis = flow.analyze(reply("m1", "sam@gmail.com", "Re: hello", "ok"));

        assertThat(analysis.fallbackUsed()).isTrue();
    }

    private void analysisReturns(String text) {
        when(contentGenerator.generate(eq("reply-analysis"), anyString(), any(GenerationRequest.class)))
            .thenReturn(GenerationResult.ok(text));
    }

    private InboundReply reply(String messageId, String sender, String subject, String body) {
        return InboundReply.builder().messageId(messageId).senderEmail(sender).subject(subject).body(body).build();
    }
}
