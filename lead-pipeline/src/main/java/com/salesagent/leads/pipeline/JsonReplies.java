package com.salesagent.leads.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for reading JSON out of model replies, which tend to arrive wrapped in
 * markdown fences or surrounded by prose.
 */
final class JsonReplies {

    private JsonReplies() {
    }

    /** Outermost {...} block of the text, if it parses as a JSON object. */
    static Optional<JsonNode> extractObject(ObjectMapper objectMapper, String reply) {
        if (reply == null) return Optional.empty();
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(reply.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** JSON booleans, or the strings "true"/"yes". */
    static boolean bool(JsonNode node) {
        if (node.isBoolean()) return node.booleanValue();
        String text = node.asText("").trim().toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("yes");
    }

    static String abbreviate(String text) {
        if (text == null) return "null";
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
