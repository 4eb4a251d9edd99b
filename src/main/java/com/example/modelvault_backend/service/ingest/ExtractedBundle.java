package com.example.modelvault_backend.service.ingest;

/**
 * In-memory result of reading an upload archive.
 *
 * @param modelExtension extension of the selected model entry including the dot, e.g. {@code .gltf}
 */
public record ExtractedBundle(
        String modelEntryName,
        byte[] modelBytes,
        String modelExtension,
        String textureEntryName,
        byte[] textureBytes
) {

    /** Extension without the dot, as stored in {@code modelType}. */
    public String modelType() {
        return modelExtension.substring(1);
    }
}
