package com.salesagent.leads.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.salesagent.leads.TestDatabase;
import com.salesagent.leads.model.InboundReply;
import com.salesagent.leads.model.ReplyOutcome;
import com.salesagent.leads.service.IdempotencyGuard;
import com.salesagent.leads.store.ProcessedKeyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReplyIntakeServiceTest {

    @Mock
    private LeadManagerFlow leadManagerFlow;

    private IdempotencyGuard guard;
    private ReplyIntakeService intake;

    @BeforeEach
    void setUp() {
        guard = new IdempotencyGuard(new ProcessedKeyRepository(TestDatabase.create()));
        intake = new ReplyIntakeService(guard, leadManagerFlow);
    }

    @Test
    void repeatedMessageIsNotReprocessed() {
        InboundReply reply = reply("msg-1");
        when(leadManagerFlow.process(reply)).thenReturn(processed("msg-1"));

        ReplyOutcome first = intake.accept(reply);
        ReplyOutcome second = intake.accept(reply);

        assertThat(first.status()).isEqualTo(ReplyOutcome.Status.PROCESSED);
        assertThat(second.status()).isEqualTo(ReplyOutcome.Status.DUPLICATE);
        verify(leadManagerFlow, times(1)).process(any());
    }

    @Test
    void failedProcessingCanBeRedelivered() {
        InboundReply reply = reply("msg-1");
        when(leadManagerFlow.process(reply)).thenReturn(
            new ReplyOutcome("msg-1", ReplyOutcome.Status.FAILED, true, true, null, "scheduling failed"),
            processed("msg-1"));

        intake.accept(reply);
        ReplyOutcome retry = intake.accept(reply);

        assertThat(retry.status()).isEqualTo(ReplyOutcome.Status.PROCESSED);
        assertThat(guard.seen(IdempotencyGuard.SCOPE_REPLY, "msg-1")).isTrue();
    }

    @Test
    void exceptionReleasesMessageId() {
        InboundReply reply = reply("msg-1");
        when(leadManagerFlow.process(reply)).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> intake.accept(reply)).isInstanceOf(IllegalStateException.class);
        assertThat(guard.seen(IdempotencyGuard.SCOPE_REPLY, "msg-1")).isFalse();
    }

    @Test
    void messageIdIsRequired() {
        assertThatThrownBy(() -> intake.accept(reply(" "))).isInstanceOf(IllegalArgumentException.class);
    }

    private InboundReply reply(String messageId) {
        return InboundReply.builder().messageId(messageId).senderEmail("anna@bakery.example")
            .subject("Re: proposal").body("Sounds good").build();
    }

    private ReplyOutcome processed(String messageId) {
        return new ReplyOutcome(messageId, ReplyOutcome.Status.PROCESSED, false, false, null, "no meeting needed");
    }
}
