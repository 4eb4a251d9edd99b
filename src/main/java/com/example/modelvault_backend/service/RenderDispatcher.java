package com.example.modelvault_backend.service;

import com.example.modelvault_backend.service.thumbnail.ThumbnailService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * One-way handoff from an upload to the thumbnail renderer. Nothing flows back to the uploader:
 * neither the render result nor a failure to schedule it.
 */
@Component
public class RenderDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderDispatcher.class);

    private final ThumbnailService thumbnailService;
    private final Executor renderExecutor;

    public RenderDispatcher(ThumbnailService thumbnailService,
                            @Qualifier("renderTaskExecutor") Executor renderExecutor) {
        this.thumbnailService = thumbnailService;
        this.renderExecutor = renderExecutor;
    }

    public void dispatch(String modelId) {
        try {
            renderExecutor.execute(() -> runRender(modelId));
            LOGGER.debug("Render dispatched modelId={}", modelId);
        } catch (RuntimeException e) {
            // covers TaskRejectedException; the model stays Uploaded
            LOGGER.error("Render dispatch failed modelId={} err={}", modelId, e.toString());
        }
    }

    private void runRender(String modelId) {
        try {
            thumbnailService.render(modelId);
        } catch (RuntimeException e) {
            LOGGER.warn("Background render ended with failure modelId={} err={}", modelId, e.toString());
        }
    }
}
