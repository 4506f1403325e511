package com.salesagent.leads.pipeline;

import com.salesagent.leads.model.InboundReply;
import com.salesagent.leads.model.ReplyOutcome;
import com.salesagent.leads.service.IdempotencyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for inbound replies. Each provider message id is processed at most once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReplyIntakeService {

    private final IdempotencyGuard idempotencyGuard;
    private final LeadManagerFlow leadManagerFlow;

    public ReplyOutcome accept(InboundReply reply) {
        if (reply.getMessageId() == null || reply.getMessageId().isBlank()) {
            throw new IllegalArgumentException("messageId is required");
        }
        if (!idempotencyGuard.acquire(IdempotencyGuard.SCOPE_REPLY, reply.getMessageId())) {
            return ReplyOutcome.duplicate(reply.getMessageId());
        }
        ReplyOutcome outcome;
        try {
            outcome = leadManagerFlow.process(reply);
        } catch (RuntimeException e) {
            idempotencyGuard.release(IdempotencyGuard.SCOPE_REPLY, reply.getMessageId());
            throw e;
        }
        if (outcome.status() == ReplyOutcome.Status.FAILED) {
            // let a redelivery try again
            idempotencyGuard.release(IdempotencyGuard.SCOPE_REPLY, reply.getMessageId());
        }
        log.info("Reply {} -> {} ({})", reply.getMessageId(), outcome.status(), outcome.reason());
        return outcome;
    }
}
