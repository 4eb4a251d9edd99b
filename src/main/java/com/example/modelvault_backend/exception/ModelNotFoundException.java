package com.example.modelvault_backend.exception;

public class ModelNotFoundException extends RuntimeException {
    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Model metadata not found (may already be deleted): " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
