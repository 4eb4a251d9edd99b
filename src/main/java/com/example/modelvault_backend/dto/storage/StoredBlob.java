package com.example.modelvault_backend.dto.storage;

public record StoredBlob(String key, String url, String etag, long sizeBytes) {
}
