package com.example.modelvault_backend.exception;

import com.example.modelvault_backend.util.ModelStatus;

public class IllegalStatusTransitionException extends IllegalStateException {
    private final ModelStatus from;
    private final ModelStatus to;

    public IllegalStatusTransitionException(String modelId, ModelStatus from, ModelStatus to) {
        super("Illegal status transition for " + modelId + ": " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public ModelStatus getFrom() {
        return from;
    }

    public ModelStatus getTo() {
        return to;
    }
}
