package com.example.modelvault_backend.service;

import com.example.modelvault_backend.dto.storage.StoredBlob;
import com.example.modelvault_backend.dto.web.UploadResponse;
import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.UpstreamException;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import com.example.modelvault_backend.service.ingest.ArchiveExtractor;
import com.example.modelvault_backend.service.ingest.ExtractedBundle;
import com.example.modelvault_backend.util.ModelKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Takes a model bundle upload through extraction, blob writes and metadata creation, then hands the
 * model to the background renderer.
 */
@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

    private final ArchiveExtractor archiveExtractor;
    private final AssetStore assetStore;
    private final MetadataRecordStore metadataStore;
    private final RenderDispatcher renderDispatcher;
    private final Clock clock;

    public UploadService(ArchiveExtractor archiveExtractor,
                         AssetStore assetStore,
                         MetadataRecordStore metadataStore,
                         RenderDispatcher renderDispatcher,
                         Clock clock) {
        this.archiveExtractor = archiveExtractor;
        this.assetStore = assetStore;
        this.metadataStore = metadataStore;
        this.renderDispatcher = renderDispatcher;
        this.clock = clock;
    }

    /**
     * Stores the bundle and returns as soon as the metadata record exists. Blobs written before a failed
     * metadata write are not cleaned up.
     */
    public UploadResponse upload(String modelName, MultipartFile file) {
        String name = modelName == null ? null : modelName.trim();
        if (name == null || name.isEmpty() || file == null || file.isEmpty()) {
            throw new ModelValidationException("NAME_OR_FILE_MISSING", "Model name or ZIP file missing.");
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            throw new ModelValidationException("ZIP_REQUIRED", "Only ZIP files are allowed.");
        }

        byte[] archive;
        try {
            archive = file.getBytes();
        } catch (IOException e) {
            throw new UpstreamException("UPLOAD_READ_FAILED", "Could not read uploaded file", e);
        }
        ExtractedBundle bundle = archiveExtractor.extract(archive, name);

        String modelId = UUID.randomUUID().toString();
        List<String> written = new ArrayList<>(2);
        try {
            StoredBlob model = assetStore.put(ModelKeys.model(modelId, bundle.modelExtension()),
                    bundle.modelBytes(), modelContentType(bundle.modelExtension()));
            written.add(model.key());
            StoredBlob texture = assetStore.put(ModelKeys.texture(modelId), bundle.textureBytes(), MediaType.IMAGE_PNG_VALUE);
            written.add(texture.key());

            ModelMetadata metadata = ModelMetadata.uploaded(modelId, name, model.url(), texture.url(),
                    bundle.modelType(), clock.millis());
            metadataStore.create(metadata);
        } catch (UpstreamException e) {
            if (!written.isEmpty()) {
                LOGGER.warn("Upload aborted modelId={} orphaned keys={} err={}", modelId, written, e.toString());
            }
            throw e;
        }

        LOGGER.info("Upload stored modelId={} name={} modelType={} modelEntry={} textureEntry={}",
                modelId, name, bundle.modelType(), bundle.modelEntryName(), bundle.textureEntryName());
        renderDispatcher.dispatch(modelId);
        return new UploadResponse(modelId, name, "Upload successful, thumbnail rendering runs in the background.");
    }

    private static String modelContentType(String extension) {
        return MediaTypeFactory.getMediaType("model" + extension)
                .orElse(MediaType.APPLICATION_OCTET_STREAM)
                .toString();
    }
}
