package com.salesagent.leads.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt texts loaded from {@code classpath:prompts/<name>.txt}.
 * Placeholders look like {@code {name}} and are replaced literally.
 */
@Component
@Slf4j
public class PromptTemplates {

    public static final String RESEARCH = "research";
    public static final String DRAFT = "draft";
    public static final String REVIEW = "review";
    public static final String CALL_SCRIPT = "call-script";
    public static final String CLASSIFY = "classify";
    public static final String REPLY_ANALYSIS = "reply-analysis";
    public static final String PROPOSAL_EMAIL = "proposal-email";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public String get(String name) {
        return cache.computeIfAbsent(name, this::load);
    }

    public String render(String name, Map<String, String> values) {
        String text = get(name);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            text = text.replace("{" + entry.getKey() + "}", entry.getValue() == null ? "" : entry.getValue());
        }
        return text;
    }

    private String load(String name) {
        ClassPathResource resource = new ClassPathResource("prompts/" + name + ".txt");
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Loaded prompt {} ({} chars)", name, text.length());
            return text;
        } catch (IOException e) {
            throw new UncheckedIOException("Missing prompt resource prompts/" + name + ".txt", e);
        }
    }
}
