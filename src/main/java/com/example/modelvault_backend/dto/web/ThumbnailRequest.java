package com.example.modelvault_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record ThumbnailRequest(@NotBlank(message = "Missing model id.") String modelId) {
}
