package com.example.modelvault_backend.dto.storage;

public record DeleteOutcome(String key, Status status, String error) {

    public enum Status {
        DELETED,
        ABSENT,
        FAILED
    }

    public static DeleteOutcome deleted(String key) {
        return new DeleteOutcome(key, Status.DELETED, null);
    }

    public static DeleteOutcome absent(String key) {
        return new DeleteOutcome(key, Status.ABSENT, null);
    }

    public static DeleteOutcome failed(String key, String error) {
        return new DeleteOutcome(key, Status.FAILED, error);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
