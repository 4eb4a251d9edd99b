package com.example.modelvault_backend.controller;

import com.example.modelvault_backend.dto.render.RenderOutcome;
import com.example.modelvault_backend.dto.web.ThumbnailRequest;
import com.example.modelvault_backend.service.thumbnail.ThumbnailService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous entry to the render cycle. Uploads schedule the same work through
 * {@link com.example.modelvault_backend.service.RenderDispatcher}.
 */
@RestController
@RequestMapping("/v1/models")
public class ThumbnailController {
    private final ThumbnailService thumbnailService;

    public ThumbnailController(ThumbnailService thumbnailService) {
        this.thumbnailService = thumbnailService;
    }

    @Operation(summary = "Render the thumbnail for a model and update its status")
    @PostMapping("/thumbnail")
    public RenderOutcome render(@Valid @RequestBody ThumbnailRequest request) {
        return thumbnailService.render(request.modelId());
    }
}
