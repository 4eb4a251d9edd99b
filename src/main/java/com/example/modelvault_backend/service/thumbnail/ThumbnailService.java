package com.example.modelvault_backend.service.thumbnail;

import com.example.modelvault_backend.config.RenderProperties;
import com.example.modelvault_backend.dto.render.RenderOutcome;
import com.example.modelvault_backend.dto.storage.LoadedMetadata;
import com.example.modelvault_backend.dto.storage.StoredBlob;
import com.example.modelvault_backend.engine.Interfaces.HeadlessRenderer;
import com.example.modelvault_backend.engine.Interfaces.HeadlessRenderer.RenderSession;
import com.example.modelvault_backend.engine.Interfaces.HeadlessRenderer.Viewport;
import com.example.modelvault_backend.exception.IllegalStatusTransitionException;
import com.example.modelvault_backend.exception.ModelNotFoundException;
import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.RenderException;
import com.example.modelvault_backend.exception.StatusEscalationException;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import com.example.modelvault_backend.service.MetadataRecordStore;
import com.example.modelvault_backend.util.ModelKeys;
import com.example.modelvault_backend.util.ModelStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Renders a model preview through the headless browser, stores it as {@code models/{id}/thumbnail.png}
 * and moves the metadata record from {@code Uploaded} to {@code Ready}, or to {@code Error} when anything
 * fails after the record was loaded.
 */
@Service
public class ThumbnailService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailService.class);

    private final HeadlessRenderer renderer;
    private final AssetStore assetStore;
    private final MetadataRecordStore metadataStore;
    private final RenderProperties properties;
    private final Clock clock;

    public ThumbnailService(HeadlessRenderer renderer,
                            AssetStore assetStore,
                            MetadataRecordStore metadataStore,
                            RenderProperties properties,
                            Clock clock) {
        this.renderer = renderer;
        this.assetStore = assetStore;
        this.metadataStore = metadataStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs one render cycle for a model still in {@code Uploaded}. The record is loaded again after the
     * capture and written conditionally. Failures are rethrown to the caller after the status degrade
     * attempt; nothing here is retried.
     *
     * @param modelId id of an uploaded model.
     * @return the terminal status and thumbnail URL.
     */
    public RenderOutcome render(String modelId) {
        if (!ModelKeys.isValidId(modelId)) {
            throw new ModelValidationException("MODEL_ID_REQUIRED", "Missing or invalid model id.");
        }
        ensureRenderable(modelId);
        Instant deadline = clock.instant().plusSeconds(properties.getSessionTimeoutSeconds());
        LoadedMetadata loaded = null;
        try {
            LOGGER.info("Thumbnail render started modelId={}", modelId);
            byte[] png = capture(modelId, deadline);
            StoredBlob thumbnail = assetStore.put(ModelKeys.thumbnail(modelId), png, MediaType.IMAGE_PNG_VALUE);

            loaded = metadataStore.load(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));
            ModelMetadata updated = loaded.metadata().copy();
            updated.markReady(thumbnail.url());
            metadataStore.replace(updated, loaded.etag());

            LOGGER.info("Thumbnail render completed modelId={} thumbnail={} size={}B version={}",
                    modelId, thumbnail.url(), thumbnail.sizeBytes(), updated.getVersion());
            return new RenderOutcome(modelId, ModelStatus.READY, thumbnail.url());
        } catch (RuntimeException ex) {
            LOGGER.error("Thumbnail render failed modelId={} err={}", modelId, ex.toString(), ex);
            if (loaded != null) {
                recordError(loaded, ex);
            }
            throw ex;
        }
    }

    // a finished model keeps its thumbnail; nothing is rendered or written for it
    private void ensureRenderable(String modelId) {
        ModelMetadata current = metadataStore.load(modelId)
                .map(LoadedMetadata::metadata)
                .orElseThrow(() -> new ModelNotFoundException(modelId));
        if (current.getStatus().isTerminal()) {
            LOGGER.warn("Thumbnail render refused modelId={} status={}", modelId, current.getStatus());
            throw new IllegalStatusTransitionException(modelId, current.getStatus(), ModelStatus.READY);
        }
    }

    private byte[] capture(String modelId, Instant deadline) {
        Viewport viewport = new Viewport(properties.getViewportWidth(), properties.getViewportHeight());
        try (RenderSession session = renderer.openSession(viewport, remaining(deadline))) {
            session.navigate(pageUrl(modelId), remaining(deadline));
            Duration completion = Duration.ofSeconds(properties.getCompletionTimeoutSeconds());
            Duration left = remaining(deadline);
            session.awaitCondition(properties.getCompletionExpression(), completion.compareTo(left) < 0 ? completion : left);
            return session.captureTransparentPng(remaining(deadline));
        }
    }

    private void recordError(LoadedMetadata loaded, RuntimeException cause) {
        ModelMetadata failed = loaded.metadata().copy();
        if (failed.getStatus() != ModelStatus.UPLOADED) {
            LOGGER.warn("Status left unchanged modelId={} status={} (already terminal)", failed.getId(), failed.getStatus());
            return;
        }
        try {
            failed.markError();
            metadataStore.replace(failed, loaded.etag());
            LOGGER.info("Status set to Error modelId={} version={}", failed.getId(), failed.getVersion());
        } catch (RuntimeException persistFailure) {
            StatusEscalationException escalation = new StatusEscalationException(failed.getId(), cause, persistFailure);
            LOGGER.error("CRITICAL could not record Error status modelId={}; not retried", failed.getId(), escalation);
        }
    }

    URI pageUrl(String modelId) {
        String encoded = URLEncoder.encode(modelId, StandardCharsets.UTF_8);
        return URI.create(properties.getPageUrlTemplate().replace("{id}", encoded));
    }

    private Duration remaining(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative() || left.isZero()) {
            throw new RenderException("Render session exceeded " + properties.getSessionTimeoutSeconds() + " s");
        }
        return left;
    }
}
