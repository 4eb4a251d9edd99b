package com.example.modelvault_backend.service;

import com.example.modelvault_backend.dto.storage.BatchDeleteResult;
import com.example.modelvault_backend.dto.storage.BlobEntry;
import com.example.modelvault_backend.dto.storage.DeleteOutcome;
import com.example.modelvault_backend.dto.storage.StoredBlob;
import com.example.modelvault_backend.dto.storage.StoredObject;
import com.example.modelvault_backend.exception.StorageException;
import com.example.modelvault_backend.exception.StorePreconditionFailedException;
import com.example.modelvault_backend.service.Interfaces.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Filesystem backed {@link AssetStore}. Objects live under {@code baseDir/<key>} and are published at
 * {@code publicBaseUrl/<key>}.
 */
public class LocalAssetStore implements AssetStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalAssetStore.class);
    private static final String TMP_PREFIX = ".upload-";
    private static final int LOCK_STRIPES = 64;

    private final Path baseDir;
    private final String publicBaseUrl;
    // conditional writes on the same key must not interleave
    private final ReentrantLock[] writeLocks = new ReentrantLock[LOCK_STRIPES];

    public LocalAssetStore(Path baseDir, String publicBaseUrl) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlashes(publicBaseUrl);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            writeLocks[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalAssetStore ready. base={}, publicBaseUrl={}", this.baseDir, this.publicBaseUrl);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + this.baseDir, e);
        }
    }

    @Override
    public StoredBlob put(String key, byte[] content, String contentType) {
        Path target = safeResolve(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            writeAtomically(target, content);
        } finally {
            lock.unlock();
        }
        LOGGER.debug("PUT key={} size={}B contentType={}", key, content.length, contentType);
        return new StoredBlob(normalizeKey(key), urlFor(key), etag(content), content.length);
    }

    @Override
    public StoredBlob putIfMatch(String key, byte[] content, String contentType, String expectedEtag) {
        Path target = safeResolve(key);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            String actual = currentEtag(target);
            if (actual == null || !actual.equals(expectedEtag)) {
                throw new StorePreconditionFailedException(normalizeKey(key), expectedEtag, actual);
            }
            writeAtomically(target, content);
        } finally {
            lock.unlock();
        }
        LOGGER.debug("PUT (if-match {}) key={} size={}B", expectedEtag, key, content.length);
        return new StoredBlob(normalizeKey(key), urlFor(key), etag(content), content.length);
    }

    @Override
    public Optional<StoredObject> get(String key) {
        Path source = safeResolve(key);
        try {
            byte[] bytes = Files.readAllBytes(source);
            return Optional.of(new StoredObject(normalizeKey(key), bytes, contentTypeOf(key), etag(bytes)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Read failed: " + key, e);
        }
    }

    @Override
    public BatchDeleteResult delete(Collection<String> keys) {
        List<DeleteOutcome> outcomes = new ArrayList<>(keys.size());
        for (String key : keys) {
            try {
                Path target = safeResolve(key);
                boolean deleted = Files.deleteIfExists(target);
                outcomes.add(deleted ? DeleteOutcome.deleted(key) : DeleteOutcome.absent(key));
            } catch (IOException | StorageException e) {
                LOGGER.warn("DELETE failed key={} err={}", key, e.toString());
                outcomes.add(DeleteOutcome.failed(key, e.getMessage()));
            }
        }
        return new BatchDeleteResult(outcomes);
    }

    @Override
    public List<BlobEntry> list(String prefix) {
        String normalizedPrefix = prefix == null ? "" : normalizeKey(prefix);
        try (Stream<Path> walk = Files.walk(baseDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith(TMP_PREFIX))
                    .map(p -> baseDir.relativize(p).toString().replace('\\', '/'))
                    .filter(key -> key.startsWith(normalizedPrefix))
                    .sorted()
                    .map(this::entryFor)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (IOException e) {
            throw new StorageException("List failed for prefix " + prefix, e);
        }
    }

    @Override
    public String urlFor(String key) {
        return publicBaseUrl + "/" + normalizeKey(key);
    }

    @Override
    public Optional<String> keyForUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String candidate = url.trim();
        int query = candidate.indexOf('?');
        if (query >= 0) {
            candidate = candidate.substring(0, query);
        }
        if (!candidate.contains("://")) {
            return Optional.of(normalizeKey(candidate));
        }
        String base = publicBaseUrl + "/";
        if (!candidate.startsWith(base) || candidate.length() == base.length()) {
            return Optional.empty();
        }
        return Optional.of(normalizeKey(candidate.substring(base.length())));
    }

    public Path root() {
        return baseDir;
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        Path p = baseDir.resolve(normalizeKey(objectKey)).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void writeAtomically(Path target, byte[] content) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), TMP_PREFIX, ".part");
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, REPLACE_EXISTING, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Write failed to " + target, e);
        }
    }

    private String currentEtag(Path target) {
        try {
            return etag(Files.readAllBytes(target));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StorageException("Read failed: " + target, e);
        }
    }

    /**
     * Empty when the object vanished after the directory walk saw it, e.g. under a concurrent delete.
     */
    Optional<BlobEntry> entryFor(String key) {
        try {
            return Optional.of(new BlobEntry(key, urlFor(key), Files.size(safeResolve(key))));
        } catch (NoSuchFileException e) {
            LOGGER.debug("LIST skipped vanished key={}", key);
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Stat failed: " + key, e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOGGER.debug("Temp file cleanup failed path={} err={}", tmp, e.toString());
        }
    }

    private ReentrantLock lockFor(String key) {
        return writeLocks[Math.floorMod(normalizeKey(key).hashCode(), LOCK_STRIPES)];
    }

    private static String contentTypeOf(String key) {
        return MediaTypeFactory.getMediaType(key)
                .orElse(MediaType.APPLICATION_OCTET_STREAM)
                .toString();
    }

    private static String etag(byte[] content) {
        return DigestUtils.md5DigestAsHex(content);
    }

    // Force forward slashes; strip leading slashes
    private static String normalizeKey(String key) {
        return key.replace('\\', '/').replaceAll("^/+", "");
    }

    private static String stripTrailingSlashes(String url) {
        return url == null ? "" : url.replaceAll("/+$", "");
    }
}
