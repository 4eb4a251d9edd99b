package com.example.modelvault_backend.dto.storage;

public record StoredObject(String key, byte[] content, String contentType, String etag) {
}
