package com.example.modelvault_backend.service;

import com.example.modelvault_backend.dto.storage.BatchDeleteResult;
import com.example.modelvault_backend.dto.storage.BlobEntry;
import com.example.modelvault_backend.dto.storage.LoadedMetadata;
import com.example.modelvault_backend.dto.web.DeleteResponse;
import com.example.modelvault_backend.exception.ModelNotFoundException;
import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.UpstreamException;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import com.example.modelvault_backend.util.ModelKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Removes a model's blobs as one best-effort batch, then its metadata record once every blob is gone.
 */
@Service
public class ModelDeletionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelDeletionService.class);

    private final AssetStore assetStore;
    private final MetadataRecordStore metadataStore;

    public ModelDeletionService(AssetStore assetStore, MetadataRecordStore metadataStore) {
        this.assetStore = assetStore;
        this.metadataStore = metadataStore;
    }

    public DeleteResponse delete(String modelId) {
        if (!ModelKeys.isValidId(modelId)) {
            throw new ModelValidationException("MODEL_ID_REQUIRED", "Missing or invalid model id.");
        }
        LoadedMetadata loaded = metadataStore.load(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));

        List<String> blobKeys = blobKeysToDelete(modelId, loaded.metadata());
        int total = blobKeys.size() + 1;
        BatchDeleteResult blobs = assetStore.delete(blobKeys);
        if (!blobs.allSucceeded()) {
            // record stays so a repeated delete can find the remaining blobs
            LOGGER.error("DELETE partial modelId={} failed={} keys={} metadata kept", modelId, blobs.failedCount(), blobs.failedKeys());
            throw partial(modelId, total - blobs.failedCount() - 1, total);
        }
        BatchDeleteResult record = assetStore.delete(List.of(ModelKeys.metadata(modelId)));
        if (!record.allSucceeded()) {
            LOGGER.error("DELETE partial modelId={} metadata not removed keys={}", modelId, record.failedKeys());
            throw partial(modelId, blobKeys.size(), total);
        }
        LOGGER.info("DELETE completed modelId={} blobs={}", modelId, blobKeys);
        return new DeleteResponse(modelId, "Model and related assets deleted.");
    }

    private static UpstreamException partial(String modelId, long deleted, int total) {
        return new UpstreamException("DELETE_PARTIAL",
                "Deleted " + deleted + " of " + total + " objects for model " + modelId);
    }

    /**
     * Every key the cascade removes, metadata key last.
     */
    List<String> keysToDelete(String modelId, ModelMetadata metadata) {
        List<String> keys = new ArrayList<>(blobKeysToDelete(modelId, metadata));
        keys.add(ModelKeys.metadata(modelId));
        return keys;
    }

    /**
     * Blobs the record points at. A missing or foreign URL falls back to the fixed key layout.
     */
    private List<String> blobKeysToDelete(String modelId, ModelMetadata metadata) {
        Set<String> keys = new LinkedHashSet<>();

        Optional<String> modelKey = keyOf(metadata.getModelUrl());
        if (modelKey.isPresent()) {
            keys.add(modelKey.get());
        } else if (metadata.getModelType() != null && !metadata.getModelType().isBlank()) {
            keys.add(ModelKeys.modelForType(modelId, metadata.getModelType()));
        } else {
            keys.addAll(modelKeysByListing(modelId));
        }

        keys.add(keyOf(metadata.getTextureUrl()).orElse(ModelKeys.texture(modelId)));
        keys.add(keyOf(metadata.getThumbnailUrl()).orElse(ModelKeys.thumbnail(modelId)));
        keys.remove(ModelKeys.metadata(modelId));
        return new ArrayList<>(keys);
    }

    private Optional<String> keyOf(String url) {
        return assetStore.keyForUrl(url);
    }

    private List<String> modelKeysByListing(String modelId) {
        String modelPrefix = ModelKeys.prefix(modelId) + "model.";
        return assetStore.list(ModelKeys.prefix(modelId)).stream()
                .map(BlobEntry::key)
                .filter(key -> key.startsWith(modelPrefix))
                .toList();
    }
}
