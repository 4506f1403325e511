package com.salesagent.leads.pipeline;

import com.salesagent.leads.model.PipelineStage;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One content stage: which prompt to use, what to feed it and where its output goes.
 *
 * @param prompt name of the prompt resource under {@code prompts/}
 * @param input  prior stage output taken from the context
 * @param output stores the generated text back into the context
 */
public record StageDefinition(PipelineStage stage,
                              String prompt,
                              Function<LeadContext, String> input,
                              BiConsumer<LeadContext, String> output) {}
