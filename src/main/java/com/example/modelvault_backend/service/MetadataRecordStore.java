package com.example.modelvault_backend.service;

import com.example.modelvault_backend.dto.storage.LoadedMetadata;
import com.example.modelvault_backend.dto.storage.StoredBlob;
import com.example.modelvault_backend.dto.storage.StoredObject;
import com.example.modelvault_backend.exception.UpstreamException;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import com.example.modelvault_backend.util.ModelKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads and writes {@link ModelMetadata} as JSON at {@code models/{id}/metadata.json}.
 * Every overwrite is conditional on the etag the record was loaded at.
 */
@Service
public class MetadataRecordStore {
    private final AssetStore assetStore;
    private final ObjectMapper objectMapper;

    public MetadataRecordStore(AssetStore assetStore, ObjectMapper objectMapper) {
        this.assetStore = assetStore;
        this.objectMapper = objectMapper;
    }

    public StoredBlob create(ModelMetadata metadata) {
        return assetStore.put(ModelKeys.metadata(metadata.getId()), serialize(metadata), MediaType.APPLICATION_JSON_VALUE);
    }

    public Optional<LoadedMetadata> load(String modelId) {
        return loadByKey(ModelKeys.metadata(modelId));
    }

    public Optional<LoadedMetadata> loadByKey(String metadataKey) {
        Optional<StoredObject> stored = assetStore.get(metadataKey);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        StoredObject object = stored.get();
        try {
            ModelMetadata metadata = objectMapper.readValue(object.content(), ModelMetadata.class);
            return Optional.of(new LoadedMetadata(metadata, object.etag()));
        } catch (IOException e) {
            throw new UpstreamException("METADATA_UNREADABLE", "Metadata at " + metadataKey + " is not readable", e);
        }
    }

    /**
     * Overwrites the whole record, provided nobody else wrote it since it was loaded.
     *
     * @throws com.example.modelvault_backend.exception.StorePreconditionFailedException on a concurrent write.
     */
    public StoredBlob replace(ModelMetadata metadata, String loadedEtag) {
        metadata.nextVersion();
        return assetStore.putIfMatch(ModelKeys.metadata(metadata.getId()), serialize(metadata),
                MediaType.APPLICATION_JSON_VALUE, loadedEtag);
    }

    private byte[] serialize(ModelMetadata metadata) {
        try {
            return objectMapper.writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metadata " + metadata.getId(), e);
        }
    }
}
