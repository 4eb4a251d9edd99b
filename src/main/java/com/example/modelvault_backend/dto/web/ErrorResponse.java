package com.example.modelvault_backend.dto.web;

public record ErrorResponse(String error, String message) {
}
