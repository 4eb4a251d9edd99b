package com.example.modelvault_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record DeleteRequest(@NotBlank(message = "Missing model id.") String id) {
}
