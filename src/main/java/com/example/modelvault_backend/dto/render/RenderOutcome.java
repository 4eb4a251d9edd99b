package com.example.modelvault_backend.dto.render;

import com.example.modelvault_backend.util.ModelStatus;

public record RenderOutcome(String id, ModelStatus status, String thumbnailUrl) {
}
