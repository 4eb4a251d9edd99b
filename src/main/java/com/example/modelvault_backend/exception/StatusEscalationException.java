package com.example.modelvault_backend.exception;

/**
 * Recording a render failure as {@code Error} failed as well. Only ever logged; never retried.
 */
public class StatusEscalationException extends RuntimeException {
    private final String modelId;

    public StatusEscalationException(String modelId, Throwable renderFailure, Throwable persistFailure) {
        super("Could not persist Error status for " + modelId + " after render failure: " + renderFailure, persistFailure);
        this.modelId = modelId;
        addSuppressed(renderFailure);
    }

    public String getModelId() {
        return modelId;
    }
}
