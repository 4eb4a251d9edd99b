package com.example.modelvault_backend.service.thumbnail;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.modelvault_backend.config.RenderProperties;
import com.example.modelvault_backend.dto.render.RenderOutcome;
import com.example.modelvault_backend.engine.Interfaces.HeadlessRenderer;
import com.example.modelvault_backend.exception.IllegalStatusTransitionException;
import com.example.modelvault_backend.exception.ModelNotFoundException;
import com.example.modelvault_backend.exception.ModelValidationException;
import com.example.modelvault_backend.exception.RenderException;
import com.example.modelvault_backend.exception.StatusEscalationException;
import com.example.modelvault_backend.exception.StorageException;
import com.example.modelvault_backend.model.ModelMetadata;
import com.example.modelvault_backend.service.LocalAssetStore;
import com.example.modelvault_backend.service.MetadataRecordStore;
import com.example.modelvault_backend.util.ModelStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ThumbnailServiceTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path tmp;

    private LocalAssetStore assetStore;
    private MetadataRecordStore metadataStore;
    private RenderProperties properties;
    private FakeRenderer renderer;
    private MutableClock clock;
    private ListAppender<ILoggingEvent> logs;

    @BeforeEach
    void setUp() {
        assetStore = new LocalAssetStore(tmp, "http://localhost/v1/files");
        metadataStore = spy(new MetadataRecordStore(assetStore, new ObjectMapper()));
        properties = new RenderProperties();
        properties.setPageUrlTemplate("http://viewer.test/render.html?id={id}");
        renderer = new FakeRenderer();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

        logs = new ListAppender<>();
        logs.start();
        ((Logger) LoggerFactory.getLogger(ThumbnailService.class)).addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(ThumbnailService.class)).detachAppender(logs);
    }

    @Test
    void successfulRenderStoresThumbnailAndMarksReady() {
        seed("m1");

        RenderOutcome outcome = service().render("m1");

        assertThat(outcome.status()).isEqualTo(ModelStatus.READY);
        assertThat(outcome.thumbnailUrl()).isEqualTo("http://localhost/v1/files/models/m1/thumbnail.png");
        assertThat(assetStore.get("models/m1/thumbnail.png").orElseThrow().content()).isEqualTo(PNG);

        ModelMetadata stored = metadataStore.load("m1").orElseThrow().metadata();
        assertThat(stored.getStatus()).isEqualTo(ModelStatus.READY);
        assertThat(stored.getThumbnailUrl()).isEqualTo(outcome.thumbnailUrl());
        assertThat(stored.getVersion()).isEqualTo(2L);

        assertThat(renderer.navigatedTo).containsExactly(URI.create("http://viewer.test/render.html?id=m1"));
        assertThat(renderer.expressions).containsExactly(properties.getCompletionExpression());
        assertThat(renderer.completionWaits).containsExactly(Duration.ofSeconds(60));
        assertThat(renderer.closed).isTrue();
    }

    @Test
    void completionTimeoutLeavesStatusUploaded() {
        seed("m1");
        renderer.completionFailure = new RenderException("Render did not finish within 60000 ms");

        assertThatThrownBy(() -> service().render("m1")).isInstanceOf(RenderException.class);

        assertThat(metadataStore.load("m1").orElseThrow().metadata().getStatus()).isEqualTo(ModelStatus.UPLOADED);
        assertThat(assetStore.get("models/m1/thumbnail.png")).isEmpty();
        assertThat(renderer.closed).isTrue();
    }

    @Test
    void sessionDeadlineCapsTheWholeCycle() {
        seed("m1");
        renderer.onNavigate = () -> clock.advance(Duration.ofSeconds(301));

        assertThatThrownBy(() -> service().render("m1"))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("300");

        assertThat(renderer.completionWaits).isEmpty();
        assertThat(renderer.closed).isTrue();
    }

    @Test
    void completionWaitShrinksToRemainingSessionTime() {
        seed("m1");
        renderer.onNavigate = () -> clock.advance(Duration.ofSeconds(270));

        service().render("m1");

        assertThat(renderer.completionWaits).containsExactly(Duration.ofSeconds(30));
    }

    @Test
    void failureAfterLoadMarksError() {
        seed("m1");
        doThrow(new StorageException("write refused"))
                .doCallRealMethod()
                .when(metadataStore).replace(any(), anyString());

        assertThatThrownBy(() -> service().render("m1")).isInstanceOf(StorageException.class);

        ModelMetadata stored = metadataStore.load("m1").orElseThrow().metadata();
        assertThat(stored.getStatus()).isEqualTo(ModelStatus.ERROR);
        assertThat(stored.getThumbnailUrl()).isNull();
    }

    @Test
    void failingErrorWriteIsEscalatedInTheLog() {
        seed("m1");
        doThrow(new StorageException("store down")).when(metadataStore).replace(any(), anyString());

        assertThatThrownBy(() -> service().render("m1"))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("store down");

        assertThat(metadataStore.load("m1").orElseThrow().metadata().getStatus()).isEqualTo(ModelStatus.UPLOADED);
        assertThat(logs.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.ERROR);
                    assertThat(event.getFormattedMessage()).contains("CRITICAL").contains("m1");
                    assertThat(event.getThrowableProxy().getClassName()).isEqualTo(StatusEscalationException.class.getName());
                });
    }

    @Test
    void missingMetadataIsNotFound() {
        assertThatThrownBy(() -> service().render("ghost")).isInstanceOf(ModelNotFoundException.class);

        assertThat(renderer.opened).isFalse();
        assertThat(assetStore.get("models/ghost/thumbnail.png")).isEmpty();
    }

    @Test
    void terminalRecordIsNotOverwritten() {
        ModelMetadata ready = ModelMetadata.uploaded("m1", "Chair", "mu", "tu", "obj", 1L);
        ready.markReady("http://localhost/v1/files/models/m1/old.png");
        metadataStore.create(ready);

        assertThatThrownBy(() -> service().render("m1")).isInstanceOf(IllegalStatusTransitionException.class);

        ModelMetadata stored = metadataStore.load("m1").orElseThrow().metadata();
        assertThat(stored.getStatus()).isEqualTo(ModelStatus.READY);
        assertThat(stored.getThumbnailUrl()).endsWith("old.png");
        assertThat(renderer.opened).isFalse();
        assertThat(assetStore.get("models/m1/thumbnail.png")).isEmpty();
    }

    @Test
    void failedModelIsNotRenderedAgain() {
        ModelMetadata failed = ModelMetadata.uploaded("m2", "Lamp", "mu", "tu", "obj", 1L);
        failed.markError();
        metadataStore.create(failed);

        assertThatThrownBy(() -> service().render("m2")).isInstanceOf(IllegalStatusTransitionException.class);

        assertThat(renderer.opened).isFalse();
        assertThat(assetStore.get("models/m2/thumbnail.png")).isEmpty();
        assertThat(metadataStore.load("m2").orElseThrow().metadata().getStatus()).isEqualTo(ModelStatus.ERROR);
    }

    @Test
    void rejectsInvalidIdBeforeRendering() {
        assertThatThrownBy(() -> service().render("../etc"))
                .isInstanceOf(ModelValidationException.class);
        assertThat(renderer.opened).isFalse();
    }

    @Test
    void pageUrlEncodesTheId() {
        assertThat(service().pageUrl("a b").toString()).isEqualTo("http://viewer.test/render.html?id=a+b");
    }

    private ThumbnailService service() {
        return new ThumbnailService(renderer, assetStore, metadataStore, properties, clock);
    }

    private void seed(String id) {
        metadataStore.create(ModelMetadata.uploaded(id, "Chair",
                "http://localhost/v1/files/models/" + id + "/model.obj",
                "http://localhost/v1/files/models/" + id + "/texture.png", "obj", 1L));
    }

    private static final class FakeRenderer implements HeadlessRenderer {
        final List<URI> navigatedTo = new ArrayList<>();
        final List<String> expressions = new ArrayList<>();
        final List<Duration> completionWaits = new ArrayList<>();
        RuntimeException completionFailure;
        Runnable onNavigate = () -> { };
        boolean opened;
        boolean closed;

        @Override
        public RenderSession openSession(Viewport viewport, Duration timeout) {
            opened = true;
            return new RenderSession() {
                @Override
                public void navigate(URI pageUrl, Duration t) {
                    navigatedTo.add(pageUrl);
                    onNavigate.run();
                }

                @Override
                public void awaitCondition(String expression, Duration t) {
                    expressions.add(expression);
                    completionWaits.add(t);
                    if (completionFailure != null) {
                        throw completionFailure;
                    }
                }

                @Override
                public byte[] captureTransparentPng(Duration t) {
                    return PNG;
                }

                @Override
                public void close() {
                    closed = true;
                }
            };
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
