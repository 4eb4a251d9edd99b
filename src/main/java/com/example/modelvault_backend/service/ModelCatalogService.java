package com.example.modelvault_backend.service;

import com.example.modelvault_backend.dto.storage.BlobEntry;
import com.example.modelvault_backend.dto.storage.LoadedMetadata;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import com.example.modelvault_backend.util.ModelKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class ModelCatalogService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCatalogService.class);

    private final AssetStore assetStore;
    private final MetadataRecordStore metadataStore;

    public ModelCatalogService(AssetStore assetStore, MetadataRecordStore metadataStore) {
        this.assetStore = assetStore;
        this.metadataStore = metadataStore;
    }

    /**
     * All readable metadata records, newest first. Unreadable records are skipped.
     */
    public List<ModelMetadata> listModels() {
        List<ModelMetadata> models = new ArrayList<>();
        for (BlobEntry entry : assetStore.list(ModelKeys.ROOT_PREFIX)) {
            if (!ModelKeys.isMetadataKey(entry.key())) {
                continue;
            }
            try {
                Optional<LoadedMetadata> loaded = metadataStore.loadByKey(entry.key());
                loaded.ifPresent(l -> models.add(l.metadata()));
            } catch (RuntimeException e) {
                LOGGER.warn("Skipping unreadable metadata key={} err={}", entry.key(), e.toString());
            }
        }
        models.sort(Comparator.comparingLong(ModelMetadata::getTimestamp).reversed());
        return models;
    }
}
