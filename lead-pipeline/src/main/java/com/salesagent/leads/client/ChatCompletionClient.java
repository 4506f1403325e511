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
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion client (Cerebras by default).
 *
 * HTTP failures are retried by the "llm" Resilience4j instance; once retries run
 * out the failure is returned as a {@link GenerationResult} rather than thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatCompletionClient implements ContentGenerator {

    private final RestTemplate restTemplate;
    private final LeadPipelineProperties properties;

    @Override
    @Retry(name = "llm", fallbackMethod = "generationFallback")
    public GenerationResult generate(String stageName, String instructions, GenerationRequest request) {
        LeadPipelineProperties.Llm llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            return GenerationResult.failed("LLM api key not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", llm.getModel());
        body.put("temperature", llm.getTemperature());
        body.put("max_tokens", llm.getMaxTokens());
        body.put("messages", List.of(
                Map.of("role", "system", "content", instructions),
                Map.of("role", "user", "content", userMessage(request))));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(llm.getApiKey());

        log.debug("Generating {} with {}", stageName, llm.getModel());
        JsonNode response = restTemplate.postForObject(
                llm.getBaseUrl() + "/chat/completions", new HttpEntity<>(body, headers), JsonNode.class);

        String text = response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
        if (text == null || text.isBlank()) {
            return GenerationResult.failed("empty completion for " + stageName);
        }
        return GenerationResult.ok(text.trim());
    }

    @SuppressWarnings("unused")
    private GenerationResult generationFallback(String stageName, String instructions,
                                                GenerationRequest request, Throwable t) {
        log.error("Generation for {} failed after retries: {}", stageName, t.getMessage());
        return GenerationResult.failed(t.getMessage());
    }

    private String userMessage(GenerationRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Business:\n").append(request.leadContext());
        if (!request.priorStageOutput().isBlank()) {
            sb.append("\n\nPrevious step output:\n").append(request.priorStageOutput());
        }
        return sb.toString();
    }
}
