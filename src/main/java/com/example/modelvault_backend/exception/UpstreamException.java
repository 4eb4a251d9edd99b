package com.example.modelvault_backend.exception;

/**
 * Failure of a collaborator the service depends on (object storage, archive parsing, headless renderer).
 * Partial state written before the failure is left in place.
 */
public class UpstreamException extends RuntimeException {
    private final String code;

    public UpstreamException(String code, String message) {
        super(message);
        this.code = code;
    }

    public UpstreamException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
