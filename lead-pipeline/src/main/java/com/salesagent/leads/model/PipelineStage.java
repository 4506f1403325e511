package com.salesagent.leads.model;

/**
 * Per-lead pipeline stages, in execution order.
 */
public enum PipelineStage {
    RESEARCH, DRAFT, REVIEW, CALL, CLASSIFY, BRANCH, FINALIZE
}
