package com.example.modelvault_backend.dto.storage;

import com.example.modelvault_backend.model.ModelMetadata;

/**
 * A metadata record together with the etag it was read at, used as the token for the next overwrite.
 */
public record LoadedMetadata(ModelMetadata metadata, String etag) {
}
