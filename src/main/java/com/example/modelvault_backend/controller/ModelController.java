package com.example.modelvault_backend.controller;

import com.example.modelvault_backend.dto.web.DeleteRequest;
import com.example.modelvault_backend.dto.web.DeleteResponse;
import com.example.modelvault_backend.dto.web.UploadResponse;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.ModelCatalogService;
import com.example.modelvault_backend.service.ModelDeletionService;
import com.example.modelvault_backend.service.UploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/v1/models")
public class ModelController {
    private final UploadService uploadService;
    private final ModelDeletionService deletionService;
    private final ModelCatalogService catalogService;

    public ModelController(UploadService uploadService,
                           ModelDeletionService deletionService,
                           ModelCatalogService catalogService) {
        this.uploadService = uploadService;
        this.deletionService = deletionService;
        this.catalogService = catalogService;
    }

    @Operation(summary = "Upload a ZIP bundle with one model file and one PNG texture")
    @ApiResponse(responseCode = "200", description = "Stored; thumbnail rendering continues in the background")
    @ApiResponse(responseCode = "400", description = "Missing name, not a ZIP, or model/texture entry missing")
    @ApiResponse(responseCode = "500", description = "Storage failure")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResponse upload(@RequestParam(value = "modelName", required = false) String modelName,
                                 @RequestPart(value = "file", required = false) MultipartFile file) {
        return uploadService.upload(modelName, file);
    }

    @Operation(summary = "List all models, newest first")
    @GetMapping
    public List<ModelMetadata> list() {
        return catalogService.listModels();
    }

    @Operation(summary = "Delete a model with its metadata, model, texture and thumbnail")
    @ApiResponse(responseCode = "200", description = "Deleted")
    @ApiResponse(responseCode = "404", description = "No metadata for this id (may already be deleted)")
    @ApiResponse(responseCode = "500", description = "Some objects could not be deleted")
    @PostMapping("/delete")
    public DeleteResponse delete(@Valid @RequestBody DeleteRequest request) {
        return deletionService.delete(request.id());
    }
}
