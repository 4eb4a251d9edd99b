package com.example.modelvault_backend.dto.web;

public record UploadResponse(String id, String name, String message) {
}
