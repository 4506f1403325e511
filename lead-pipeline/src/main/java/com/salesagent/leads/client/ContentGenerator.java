package com.salesagent.leads.client;

/**
 * Natural-language generation collaborator used by the content stages and the classifier.
 */
public interface ContentGenerator {

    /**
     * @param stageName    short name used in logs, e.g. "research"
     * @param instructions system prompt for the stage
     * @return never null; failures come back as {@link GenerationResult#failed(String)}
     */
    GenerationResult generate(String stageName, String instructions, GenerationRequest request);
}
