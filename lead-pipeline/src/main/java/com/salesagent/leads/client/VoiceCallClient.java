package com.salesagent.leads.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.CallResult;
import com.salesagent.leads.model.CallStatus;
import com.salesagent.leads.model.TranscriptTurn;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places outbound calls through an ElevenLabs conversational agent and polls the
 * conversation until it ends.
 *
 * Only the call initiation is retried. Once a call is ringing, poll errors are
 * logged and polling continues, so a flaky status endpoint never dials twice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VoiceCallClient implements CallingClient {

    private static final Set<String> DONE = Set.of("done", "completed");
    private static final Set<String> NO_ANSWER = Set.of("no_answer", "busy", "rejected", "declined");
    private static final Set<String> FAILED = Set.of("failed", "error");

    private final RestTemplate restTemplate;
    private final LeadPipelineProperties properties;

    @Override
    @Retry(name = "calling", fallbackMethod = "callFallback")
    public CallResult placeCall(CallRequest request) {
        LeadPipelineProperties.Calling config = properties.getCalling();
        if (isBlank(config.getApiKey()) || isBlank(config.getAgentId()) || isBlank(config.getPhoneNumberId())) {
            return CallResult.error("calling api key, agent id or phone number id not configured");
        }

        String conversationId = initiate(request, config);
        if (conversationId == null) {
            return CallResult.error("call initiated but no conversation id returned");
        }
        log.info("Call to {} initiated, conversation {}", request.leadName(), conversationId);
        return poll(conversationId, config);
    }

    @SuppressWarnings("unused")
    private CallResult callFallback(CallRequest request, Throwable t) {
        log.error("Call to {} could not be placed: {}", request.leadName(), t.getMessage());
        return CallResult.error("Error making call: " + t.getMessage());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String initiate(CallRequest request, LeadPipelineProperties.Calling config) {
        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("prompt", Map.of("prompt", request.scriptText()));
        agent.put("language", "en");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agent_id", config.getAgentId());
        body.put("agent_phone_number_id", config.getPhoneNumberId());
        body.put("to_number", request.phoneNumber());
        body.put("conversation_initiation_client_data", Map.of(
                "conversation_config_override", Map.of("agent", agent),
                "dynamic_variables", Map.of("customer_name", request.leadName() == null ? "" : request.leadName())));

        JsonNode response = restTemplate.postForObject(
                config.getBaseUrl() + "/v1/convai/twilio/outbound-call",
                new HttpEntity<>(body, headers(config)), JsonNode.class);
        if (response == null) return null;
        for (String field : List.of("conversation_id", "id", "call_id")) {
            String value = response.path(field).asText(null);
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    private CallResult poll(String conversationId, LeadPipelineProperties.Calling config) {
        String url = config.getBaseUrl() + "/v1/convai/conversations/" + conversationId;
        List<TranscriptTurn> transcript = new ArrayList<>();

        for (int attempt = 1; attempt <= config.getMaxPolls(); attempt++) {
            try {
                Thread.sleep(config.getPollInterval().toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return new CallResult(CallStatus.ERROR, transcript, conversationId, "call polling interrupted");
            }

            JsonNode conversation;
            try {
                conversation = restTemplate.exchange(url, HttpMethod.GET,
                        new HttpEntity<>(headers(config)), JsonNode.class).getBody();
            } catch (RestClientException e) {
                log.warn("Polling conversation {} failed (attempt {}): {}", conversationId, attempt, e.getMessage());
                continue;
            }
            if (conversation == null) continue;

            transcript = readTranscript(conversation.path("transcript"), transcript);
            String status = conversation.path("status").asText("");
            log.debug("Conversation {} poll {}: status={}", conversationId, attempt, status);

            if (DONE.contains(status)) {
                log.info("Call {} completed with {} transcript turn(s)", conversationId, transcript.size());
                return new CallResult(CallStatus.DONE, transcript, conversationId, null);
            }
            if (NO_ANSWER.contains(status)) {
                log.info("Call {} ended with status {}", conversationId, status);
                return CallResult.noAnswer(conversationId, "Call " + status + ". No conversation took place.");
            }
            if (FAILED.contains(status)) {
                return new CallResult(CallStatus.FAILED, List.of(), conversationId, "Call failed with status: " + status);
            }
        }
        return new CallResult(CallStatus.ERROR, transcript, conversationId, "Call status polling timeout");
    }

    private List<TranscriptTurn> readTranscript(JsonNode turns, List<TranscriptTurn> previous) {
        if (!turns.isArray() || turns.isEmpty()) return previous;
        List<TranscriptTurn> result = new ArrayList<>();
        for (JsonNode turn : turns) {
            String text = turn.hasNonNull("message") ? turn.path("message").asText() : turn.path("text").asText("");
            result.add(new TranscriptTurn(turn.path("role").asText("unknown"), text));
        }
        return result;
    }

    private HttpHeaders headers(LeadPipelineProperties.Calling config) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("xi-api-key", config.getApiKey());
        return headers;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
