package com.salesagent.leads.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesagent.leads.model.BranchDecision;
import com.salesagent.leads.model.Classification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns the classifier's reply into a {@link Classification}.
 *
 * Models wrap JSON in markdown fences or surround it with prose, so the first
 * {...} block is extracted before parsing. Anything unusable becomes OTHER and
 * is flagged ambiguous; it is never an error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClassificationParser {

    private final ObjectMapper objectMapper;

    public Classification parse(String reply) {
        Optional<JsonNode> json = JsonReplies.extractObject(objectMapper, reply);
        if (json.isEmpty()) {
            log.warn("Classifier reply is not JSON, defaulting to OTHER: {}", JsonReplies.abbreviate(reply));
            return new Classification(BranchDecision.OTHER, null, null, true);
        }
        JsonNode node = json.get();
        String category = node.path("call_category").asText(null);
        boolean known = BranchDecision.isKnownLabel(category);
        if (!known) {
            log.warn("Unknown call_category '{}', defaulting to OTHER", category);
        }
        return new Classification(
                BranchDecision.fromLabel(category),
                email(node.path("email").asText(null)),
                blankToNull(node.path("note").asText(null)),
                !known);
    }

    private String email(String value) {
        String v = blankToNull(value);
        if (v == null || !v.contains("@") || v.contains(" ")) return null;
        return v;
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
