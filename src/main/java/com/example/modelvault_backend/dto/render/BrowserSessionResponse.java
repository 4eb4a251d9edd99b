package com.example.modelvault_backend.dto.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BrowserSessionResponse(String sessionId) {
}
