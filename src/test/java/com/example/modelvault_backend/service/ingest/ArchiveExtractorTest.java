package com.example.modelvault_backend.service.ingest;

import com.example.modelvault_backend.exception.ModelValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.example.modelvault_backend.support.TestArchives.storedWithDataDescriptor;
import static com.example.modelvault_backend.support.TestArchives.zip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveExtractorTest {

    private final ArchiveExtractor extractor = new ArchiveExtractor();

    @Test
    void extractsModelAndTexture() {
        ExtractedBundle bundle = extractor.extract(zip("mesh.obj", "skin.png"), "Chair");

        assertThat(bundle.modelEntryName()).isEqualTo("mesh.obj");
        assertThat(bundle.modelExtension()).isEqualTo(".obj");
        assertThat(bundle.modelType()).isEqualTo("obj");
        assertThat(new String(bundle.modelBytes(), StandardCharsets.UTF_8)).isEqualTo("mesh.obj");
        assertThat(bundle.textureEntryName()).isEqualTo("skin.png");
        assertThat(new String(bundle.textureBytes(), StandardCharsets.UTF_8)).isEqualTo("skin.png");
    }

    @Test
    void firstMatchingEntryWinsInArchiveOrder() {
        ExtractedBundle bundle = extractor.extract(
                zip("b/second.gltf", "a/first.obj", "z.png", "a.png"), "Lamp");

        assertThat(bundle.modelEntryName()).isEqualTo("b/second.gltf");
        assertThat(bundle.modelType()).isEqualTo("gltf");
        assertThat(bundle.textureEntryName()).isEqualTo("z.png");
    }

    @Test
    void matchesExtensionsCaseInsensitively() {
        ExtractedBundle bundle = extractor.extract(zip("MODEL.GLB", "Texture.PNG"), "Box");

        assertThat(bundle.modelExtension()).isEqualTo(".glb");
        assertThat(bundle.textureEntryName()).isEqualTo("Texture.PNG");
    }

    @Test
    void skipsDirectoryEntries() {
        ExtractedBundle bundle = extractor.extract(zip("looks.obj/", "textures/", "real.json", "textures/t.png"), "Dir");

        assertThat(bundle.modelEntryName()).isEqualTo("real.json");
        assertThat(bundle.modelType()).isEqualTo("json");
        assertThat(bundle.textureEntryName()).isEqualTo("textures/t.png");
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> extractor.extract(zip("mesh.obj", "skin.png"), "  "))
                .isInstanceOf(ModelValidationException.class)
                .extracting("code").isEqualTo("NAME_REQUIRED");
    }

    @Test
    void rejectsPayloadThatIsNotAZip() {
        assertThatThrownBy(() -> extractor.extract("definitely not a zip".getBytes(StandardCharsets.UTF_8), "Chair"))
                .isInstanceOf(ModelValidationException.class)
                .extracting("code").isEqualTo("ARCHIVE_INVALID");
    }

    @Test
    void rejectsArchiveWithoutModel() {
        assertThatThrownBy(() -> extractor.extract(zip("skin.png", "readme.txt"), "Chair"))
                .isInstanceOf(ModelValidationException.class)
                .extracting("code").isEqualTo("MODEL_FILE_MISSING");
    }

    @Test
    void rejectsArchiveWithoutTexture() {
        assertThatThrownBy(() -> extractor.extract(zip("mesh.obj", "skin.jpg"), "Chair"))
                .isInstanceOf(ModelValidationException.class)
                .extracting("code").isEqualTo("TEXTURE_FILE_MISSING");
    }

    @Test
    void readsStoredEntriesWithDataDescriptor() {
        ExtractedBundle bundle = extractor.extract(storedWithDataDescriptor("mesh.obj", "skin.png"), "Chair");

        assertThat(bundle.modelEntryName()).isEqualTo("mesh.obj");
        assertThat(new String(bundle.modelBytes(), StandardCharsets.UTF_8)).isEqualTo("mesh.obj");
        assertThat(new String(bundle.textureBytes(), StandardCharsets.UTF_8)).isEqualTo("skin.png");
    }

    @Test
    void rejectsEntryInflatingBeyondLimit() {
        ArchiveExtractor small = new ArchiveExtractor(4);

        assertThatThrownBy(() -> small.extract(zip("mesh.obj", "skin.png"), "Chair"))
                .isInstanceOf(ModelValidationException.class)
                .extracting("code").isEqualTo("ENTRY_TOO_LARGE");
    }

    @Test
    void entriesWithinLimitAreAccepted() {
        ArchiveExtractor exact = new ArchiveExtractor("mesh.obj".length());

        assertThat(exact.extract(zip("mesh.obj", "skin.png"), "Chair").modelEntryName()).isEqualTo("mesh.obj");
    }
}
