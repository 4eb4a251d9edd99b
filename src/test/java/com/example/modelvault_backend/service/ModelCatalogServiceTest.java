package com.example.modelvault_backend.service;

import com.example.modelvault_backend.model.ModelMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ModelCatalogServiceTest {

    @TempDir
    Path tmp;

    private LocalAssetStore assetStore;
    private MetadataRecordStore metadataStore;
    private ModelCatalogService catalogService;

    @BeforeEach
    void setUp() {
        assetStore = new LocalAssetStore(tmp, "http://localhost/v1/files");
        metadataStore = new MetadataRecordStore(assetStore, new ObjectMapper());
        catalogService = new ModelCatalogService(assetStore, metadataStore);
    }

    @Test
    void emptyStoreListsNothing() {
        assertThat(catalogService.listModels()).isEmpty();
    }

    @Test
    void listsNewestFirstAndIgnoresOtherBlobs() {
        metadataStore.create(ModelMetadata.uploaded("old", "Old", "u", "t", "obj", 100L));
        metadataStore.create(ModelMetadata.uploaded("new", "New", "u", "t", "obj", 300L));
        metadataStore.create(ModelMetadata.uploaded("mid", "Mid", "u", "t", "obj", 200L));
        assetStore.put("models/new/texture.png", new byte[]{1}, "image/png");

        assertThat(catalogService.listModels())
                .extracting(ModelMetadata::getId)
                .containsExactly("new", "mid", "old");
    }

    @Test
    void skipsUnreadableRecords() {
        metadataStore.create(ModelMetadata.uploaded("good", "Good", "u", "t", "obj", 100L));
        assetStore.put("models/broken/metadata.json", "{oops".getBytes(StandardCharsets.UTF_8), "application/json");

        assertThat(catalogService.listModels())
                .extracting(ModelMetadata::getId)
                .containsExactly("good");
    }
}
