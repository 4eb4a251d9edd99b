package com.example.modelvault_backend.exception;

public class RenderException extends UpstreamException {

    public RenderException(String message) {
        super("RENDER_FAILED", message);
    }

    public RenderException(String message, Throwable cause) {
        super("RENDER_FAILED", message, cause);
    }
}
