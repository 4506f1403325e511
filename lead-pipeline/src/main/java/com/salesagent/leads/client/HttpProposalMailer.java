package com.salesagent.leads.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesagent.leads.config.LeadPipelineProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Sends proposal emails by posting JSON to a mail relay.
 * Failures propagate after the "mail" retry so the caller's idempotency key is released.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpProposalMailer implements ProposalMailer {

    private final RestTemplate restTemplate;
    private final LeadPipelineProperties properties;

    @Override
    @Retry(name = "mail")
    public String send(String to, String subject, String body) {
        LeadPipelineProperties.Mail mail = properties.getMail();
        if (mail.getRelayUrl() == null || mail.getRelayUrl().isBlank()) {
            throw new IllegalStateException("mail relay url not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", mail.getFromAddress());
        payload.put("to", to);
        payload.put("subject", subject);
        payload.put("text", body);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (mail.getApiKey() != null && !mail.getApiKey().isBlank()) {
            headers.setBearerAuth(mail.getApiKey());
        }

        JsonNode response = restTemplate.postForObject(mail.getRelayUrl(), new HttpEntity<>(payload, headers), JsonNode.class);
        String messageId = response == null ? null : response.path("id").asText(null);
        if (messageId == null && response != null) {
            messageId = response.path("messageId").asText(null);
        }
        if (messageId == null) {
            messageId = "local-" + UUID.randomUUID();
        }
        log.info("Proposal email sent to {} (message {})", to, messageId);
        return messageId;
    }
}
