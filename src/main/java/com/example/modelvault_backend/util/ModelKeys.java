package com.example.modelvault_backend.util;

/**
 * Fixed object key layout for a model's blobs. The metadata record's URL fields stay authoritative;
 * these keys are what the record points at when it was written by this service.
 */
public final class ModelKeys {
    public static final String ROOT_PREFIX = "models/";
    public static final String METADATA_SUFFIX = "/metadata.json";

    private ModelKeys() {
    }

    public static String prefix(String modelId) {
        return ROOT_PREFIX + modelId + "/";
    }

    /**
     * @param extension extension including the leading dot, e.g. {@code .obj}
     */
    public static String model(String modelId, String extension) {
        return prefix(modelId) + "model" + extension;
    }

    public static String modelForType(String modelId, String modelType) {
        return model(modelId, "." + modelType);
    }

    public static String texture(String modelId) {
        return prefix(modelId) + "texture.png";
    }

    public static String thumbnail(String modelId) {
        return prefix(modelId) + "thumbnail.png";
    }

    public static String metadata(String modelId) {
        return ROOT_PREFIX + modelId + METADATA_SUFFIX;
    }

    /**
     * Ids end up inside object keys, so anything that could climb out of {@code models/{id}/} is rejected.
     */
    public static boolean isValidId(String modelId) {
        return modelId != null && !modelId.isBlank() && modelId.matches("[A-Za-z0-9][A-Za-z0-9._-]*") && !modelId.contains("..");
    }

    public static boolean isMetadataKey(String key) {
        return key != null && key.startsWith(ROOT_PREFIX) && key.endsWith(METADATA_SUFFIX);
    }
}
