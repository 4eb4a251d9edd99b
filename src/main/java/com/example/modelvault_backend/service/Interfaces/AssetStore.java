package com.example.modelvault_backend.service.Interfaces;

import com.example.modelvault_backend.dto.storage.BatchDeleteResult;
import com.example.modelvault_backend.dto.storage.BlobEntry;
import com.example.modelvault_backend.dto.storage.StoredBlob;
import com.example.modelvault_backend.dto.storage.StoredObject;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Key based object storage. Every call is independent network or disk I/O and may fail on its own;
 * nothing spans more than one key atomically.
 */
public interface AssetStore {

    /** Unconditional write; replaces whatever is stored at the key. */
    StoredBlob put(String key, byte[] content, String contentType);

    /**
     * Writes only when the object currently stored at {@code key} has the given etag.
     *
     * @throws com.example.modelvault_backend.exception.StorePreconditionFailedException when the key is absent
     *         or its etag differs.
     */
    StoredBlob putIfMatch(String key, byte[] content, String contentType, String expectedEtag);

    Optional<StoredObject> get(String key);

    /** Deletes each key on its own. Absent keys are reported as {@code ABSENT}, not as failures. */
    BatchDeleteResult delete(Collection<String> keys);

    List<BlobEntry> list(String prefix);

    /** Public URL under which the object at {@code key} is served. */
    String urlFor(String key);

    /** Reverse of {@link #urlFor(String)}; empty when the URL does not point into this store. */
    Optional<String> keyForUrl(String url);
}
