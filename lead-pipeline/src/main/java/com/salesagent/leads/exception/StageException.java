package com.salesagent.leads.exception;

import com.salesagent.leads.model.PipelineStage;

/**
 * A collaborator failed during one stage. Halts that lead's run only.
 */
public class StageException extends RuntimeException {

    private final PipelineStage stage;

    public StageException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
