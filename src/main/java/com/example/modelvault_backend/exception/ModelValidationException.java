package com.example.modelvault_backend.exception;

/**
 * Bad or missing client input. Raised before anything is written.
 */
public class ModelValidationException extends RuntimeException {
    private final String code;

    public ModelValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ModelValidationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
