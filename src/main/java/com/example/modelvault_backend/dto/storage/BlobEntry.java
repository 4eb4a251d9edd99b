package com.example.modelvault_backend.dto.storage;

public record BlobEntry(String key, String url, long sizeBytes) {
}
