package com.example.modelvault_backend.controller;

import com.example.modelvault_backend.dto.storage.StoredObject;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Serves stored blobs so that the URLs kept in metadata records resolve.
 */
@RestController
@RequestMapping("/v1/files")
public class FileController {

    private static final String PREFIX = "/v1/files/";

    private final AssetStore assetStore;

    public FileController(AssetStore assetStore) {
        this.assetStore = assetStore;
    }

    @GetMapping(value = "/**", produces = MediaType.ALL_VALUE)
    public ResponseEntity<byte[]> get(HttpServletRequest req,
                                      @RequestHeader(value = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        String objectKey = extractTailFromWildcard(req, PREFIX);
        if (objectKey == null || objectKey.isBlank()) {
            return ResponseEntity.badRequest().build();
        }

        Optional<StoredObject> stored = assetStore.get(objectKey);
        if (stored.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        StoredObject object = stored.get();
        String etag = "\"" + object.etag() + "\"";
        if (etag.equals(ifNoneMatch)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(object.contentType()))
                .eTag(etag)
                .cacheControl(CacheControl.noCache())
                .body(object.content());
    }

    private static String extractTailFromWildcard(HttpServletRequest req, String prefix) {
        // decode exactly once; tolerate duplicate leading slashes
        String uri = URLDecoder.decode(req.getRequestURI(), StandardCharsets.UTF_8);
        int i = uri.indexOf(prefix);
        if (i < 0) {
            return null;
        }
        String tail = uri.substring(i + prefix.length());
        while (tail.startsWith("/")) tail = tail.substring(1);
        return tail;
    }
}
