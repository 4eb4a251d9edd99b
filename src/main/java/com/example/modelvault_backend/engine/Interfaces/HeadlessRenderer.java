package com.example.modelvault_backend.engine.Interfaces;

import java.net.URI;
import java.time.Duration;

/**
 * External headless browser used to draw model previews. This service only navigates it to a page,
 * waits for the page to signal completion and captures the result.
 */
public interface HeadlessRenderer {

    RenderSession openSession(Viewport viewport, Duration timeout);

    interface RenderSession extends AutoCloseable {

        void navigate(URI pageUrl, Duration timeout);

        /**
         * Blocks until the page-side expression evaluates to true.
         *
         * @throws com.example.modelvault_backend.exception.RenderException when {@code timeout} elapses first.
         */
        void awaitCondition(String expression, Duration timeout);

        /** PNG of the viewport with the page background left transparent. */
        byte[] captureTransparentPng(Duration timeout);

        @Override
        void close();
    }

    record Viewport(int width, int height) {
    }
}
