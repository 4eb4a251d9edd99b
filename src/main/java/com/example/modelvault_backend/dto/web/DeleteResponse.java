package com.example.modelvault_backend.dto.web;

public record DeleteResponse(String id, String message) {
}
