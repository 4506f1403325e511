package com.salesagent.leads.client;

/**
 * @param priorStageOutput output of the previous stage, empty for the first one
 * @param leadContext      canonical lead fields as {@code key: value} lines
 */
public record GenerationRequest(String priorStageOutput, String leadContext) {

    public GenerationRequest {
        priorStageOutput = priorStageOutput == null ? "" : priorStageOutput;
        leadContext = leadContext == null ? "" : leadContext;
    }
}
