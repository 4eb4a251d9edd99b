package com.example.modelvault_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelStatus {
    UPLOADED("Uploaded"),
    READY("Ready"),
    ERROR("Error");

    private final String id;

    ModelStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isTerminal() {
        return this != UPLOADED;
    }

    @JsonCreator
    public static ModelStatus fromId(String value) {
        for (ModelStatus status : values()) {
            if (status.id.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown model status: " + value);
    }
}
