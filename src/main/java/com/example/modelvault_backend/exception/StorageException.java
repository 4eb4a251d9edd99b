package com.example.modelvault_backend.exception;

public class StorageException extends UpstreamException {

    public StorageException(String message) {
        super("STORAGE_FAILED", message);
    }

    public StorageException(String message, Throwable cause) {
        super("STORAGE_FAILED", message, cause);
    }
}
