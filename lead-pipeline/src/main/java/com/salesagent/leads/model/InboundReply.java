package com.salesagent.leads.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An e-mail reply from a prospect, as delivered to the intake endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundReply {

    /** Provider message id, used as the idempotency key */
    private String messageId;
    private String senderEmail;
    private String senderName;
    private String subject;
    private String body;
    private LocalDateTime receivedAt;
}
