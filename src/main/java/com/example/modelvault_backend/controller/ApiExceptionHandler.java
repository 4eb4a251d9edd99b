package com.example.modelvault_backend.controller;

import com.example.modelvault_backend.dto.web.ErrorResponse;
import com.example.modelvault_backend.exception.IllegalStatusTransitionException;
import com.example.modelvault_backend.exception.ModelNotFoundException;
import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps the model error taxonomy onto HTTP: validation 400, not found 404, upstream 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ModelValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(ModelValidationException e) {
        return new ErrorResponse(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleInvalidBody(MethodArgumentNotValidException e) {
        var fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request.";
        return new ErrorResponse("BAD_REQUEST", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(Exception e) {
        return new ErrorResponse("BAD_REQUEST", "Malformed request.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleTooLarge(MaxUploadSizeExceededException e) {
        return new ErrorResponse("UPLOAD_TOO_LARGE", "Upload exceeds the maximum allowed size.");
    }

    @ExceptionHandler(ModelNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(ModelNotFoundException e) {
        return new ErrorResponse("NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalStatusTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleConflict(IllegalStatusTransitionException e) {
        return new ErrorResponse("STATUS_CONFLICT", e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUpstream(UpstreamException e) {
        LOGGER.error("Upstream failure code={} err={}", e.getCode(), e.toString());
        return new ErrorResponse(e.getCode(), "Internal server error: " + e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUnexpected(RuntimeException e) {
        LOGGER.error("Unhandled failure", e);
        return new ErrorResponse("INTERNAL_ERROR", "Internal server error: " + e.getMessage());
    }
}
