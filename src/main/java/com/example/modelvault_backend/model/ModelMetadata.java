package com.example.modelvault_backend.model;

import com.example.modelvault_backend.exception.IllegalStatusTransitionException;
import com.example.modelvault_backend.util.ModelStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-model descriptor stored next to the blobs it points at. Holds the render status, the blob URLs
 * and the creation timestamp used for ordering.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetadata {
    private final String id;
    private final String name;
    private final String modelUrl;
    private final String textureUrl;
    private final String modelType;
    private final long timestamp;
    private ModelStatus status;
    private String thumbnailUrl;
    private long version;

    @JsonCreator
    public ModelMetadata(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("modelUrl") String modelUrl,
                         @JsonProperty("textureUrl") String textureUrl,
                         @JsonProperty("modelType") String modelType,
                         @JsonProperty("status") ModelStatus status,
                         @JsonProperty("thumbnailUrl") String thumbnailUrl,
                         @JsonProperty("timestamp") long timestamp,
                         @JsonProperty("version") long version) {
        this.id = id;
        this.name = name;
        this.modelUrl = modelUrl;
        this.textureUrl = textureUrl;
        this.modelType = modelType;
        this.status = status;
        this.thumbnailUrl = thumbnailUrl;
        this.timestamp = timestamp;
        this.version = version;
    }

    public static ModelMetadata uploaded(String id, String name, String modelUrl, String textureUrl,
                                         String modelType, long timestamp) {
        return new ModelMetadata(id, name, modelUrl, textureUrl, modelType, ModelStatus.UPLOADED, null, timestamp, 1L);
    }

    public ModelMetadata copy() {
        return new ModelMetadata(id, name, modelUrl, textureUrl, modelType, status, thumbnailUrl, timestamp, version);
    }

    public void markReady(String thumbnailUrl) {
        requireUploaded(ModelStatus.READY);
        this.status = ModelStatus.READY;
        this.thumbnailUrl = thumbnailUrl;
    }

    public void markError() {
        requireUploaded(ModelStatus.ERROR);
        this.status = ModelStatus.ERROR;
    }

    /**
     * Bumps the write counter before an overwrite.
     */
    public void nextVersion() {
        this.version++;
    }

    private void requireUploaded(ModelStatus target) {
        if (status != ModelStatus.UPLOADED) {
            throw new IllegalStatusTransitionException(id, status, target);
        }
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getModelUrl() { return modelUrl; }
    public String getTextureUrl() { return textureUrl; }
    public String getModelType() { return modelType; }
    public ModelStatus getStatus() { return status; }
    public String getThumbnailUrl() { return thumbnailUrl; }
    public long getTimestamp() { return timestamp; }
    public long getVersion() { return version; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelMetadata that)) return false;
        return timestamp == that.timestamp && version == that.version && Objects.equals(id, that.id)
                && Objects.equals(name, that.name) && Objects.equals(modelUrl, that.modelUrl)
                && Objects.equals(textureUrl, that.textureUrl) && Objects.equals(modelType, that.modelType)
                && status == that.status && Objects.equals(thumbnailUrl, that.thumbnailUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, modelUrl, textureUrl, modelType, status, thumbnailUrl, timestamp, version);
    }

    @Override
    public String toString() {
        return "ModelMetadata{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", modelType='" + modelType + '\'' +
                ", status=" + status +
                ", timestamp=" + timestamp +
                ", version=" + version +
                '}';
    }
}
