package com.example.modelvault_backend.service.ingest;

import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads an uploaded ZIP bundle and picks the model and texture entries.
 * <p>
 * Selection is purely by central directory order: the first non-directory entry whose name ends in a model
 * extension becomes the model, the first one ending in {@code .png} becomes the texture. Entry contents are
 * not inspected.
 */
@Component
public class ArchiveExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveExtractor.class);

    public static final List<String> MODEL_EXTENSIONS = List.of(".obj", ".gltf", ".glb", ".json");
    public static final String TEXTURE_EXTENSION = ".png";
    static final long DEFAULT_MAX_ENTRY_BYTES = 256L * 1024 * 1024;

    private final long maxEntryBytes;

    public ArchiveExtractor() {
        this(DEFAULT_MAX_ENTRY_BYTES);
    }

    ArchiveExtractor(long maxEntryBytes) {
        this.maxEntryBytes = maxEntryBytes;
    }

    public ExtractedBundle extract(byte[] archive, String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new ModelValidationException("NAME_REQUIRED", "Model name is required.");
        }
        if (archive == null || archive.length == 0) {
            throw new ModelValidationException("ARCHIVE_INVALID", "Archive is empty.");
        }

        // ZipFile needs random access to the central directory
        Path tmp = spool(archive);
        try {
            return extract(tmp);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                LOGGER.warn("Archive temp file not removed path={} err={}", tmp, e.toString());
            }
        }
    }

    private ExtractedBundle extract(Path archive) {
        String modelEntry = null;
        byte[] modelBytes = null;
        String modelExtension = null;
        String textureEntry = null;
        byte[] textureBytes = null;
        int entries = 0;

        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> all = zip.entries();
            while (all.hasMoreElements()) {
                ZipEntry entry = all.nextElement();
                entries++;
                if (entry.isDirectory()) {
                    continue;
                }
                String fileName = entry.getName().toLowerCase(Locale.ROOT);

                if (textureBytes == null && fileName.endsWith(TEXTURE_EXTENSION)) {
                    textureEntry = entry.getName();
                    textureBytes = read(zip, entry);
                    continue;
                }
                if (modelBytes == null) {
                    String ext = matchModelExtension(fileName);
                    if (ext != null) {
                        modelEntry = entry.getName();
                        modelExtension = ext;
                        modelBytes = read(zip, entry);
                    }
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ModelValidationException("ARCHIVE_INVALID", "Upload is not a readable ZIP archive.", e);
        }

        if (entries == 0) {
            throw new ModelValidationException("ARCHIVE_INVALID", "Upload is not a readable ZIP archive.");
        }
        if (modelBytes == null) {
            throw new ModelValidationException("MODEL_FILE_MISSING",
                    "No supported model file (" + String.join(", ", MODEL_EXTENSIONS) + ") found in the ZIP.");
        }
        if (textureBytes == null) {
            throw new ModelValidationException("TEXTURE_FILE_MISSING", "No texture file (.png) found in the ZIP.");
        }

        LOGGER.debug("Archive extracted model={} ({}B) texture={} ({}B) entries={}",
                modelEntry, modelBytes.length, textureEntry, textureBytes.length, entries);
        return new ExtractedBundle(modelEntry, modelBytes, modelExtension, textureEntry, textureBytes);
    }

    // bound applies to the inflated bytes, not only the declared size
    private byte[] read(ZipFile zip, ZipEntry entry) throws IOException {
        if (entry.getSize() > maxEntryBytes) {
            throw tooLarge(entry);
        }
        try (InputStream in = zip.getInputStream(entry)) {
            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxEntryBytes + 1));
            if (bytes.length > maxEntryBytes) {
                throw tooLarge(entry);
            }
            return bytes;
        } catch (ZipException e) {
            throw new ModelValidationException("ARCHIVE_INVALID", "Upload is not a readable ZIP archive.", e);
        }
    }

    private ModelValidationException tooLarge(ZipEntry entry) {
        return new ModelValidationException("ENTRY_TOO_LARGE",
                "Entry " + entry.getName() + " exceeds " + maxEntryBytes + " bytes when extracted.");
    }

    private static Path spool(byte[] archive) {
        try {
            Path tmp = Files.createTempFile("model-upload-", ".zip");
            Files.write(tmp, archive);
            return tmp;
        } catch (IOException e) {
            throw new UpstreamException("UPLOAD_READ_FAILED", "Could not buffer uploaded archive", e);
        }
    }

    static String matchModelExtension(String lowerCaseName) {
        for (String ext : MODEL_EXTENSIONS) {
            if (lowerCaseName.endsWith(ext)) {
                return ext;
            }
        }
        return null;
    }
}
