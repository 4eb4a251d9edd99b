package com.example.modelvault_backend.engine;

import com.example.modelvault_backend.dto.render.BrowserSessionResponse;
import com.example.modelvault_backend.dto.render.WaitForFunctionResponse;
import com.example.modelvault_backend.engine.Interfaces.HeadlessRenderer;
import com.example.modelvault_backend.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link HeadlessRenderer} backed by a remote headless browser gateway speaking JSON over HTTP.
 */
@Component
public class RemoteBrowserRenderer implements HeadlessRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteBrowserRenderer.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;

    public RemoteBrowserRenderer(@Qualifier("browserWebClient") WebClient client) {
        this.client = client;
    }

    @Override
    public RenderSession openSession(Viewport viewport, Duration timeout) {
        BrowserSessionResponse created = call("open session", timeout, client.post()
                .uri("/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("width", viewport.width(), "height", viewport.height()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new RenderException("Browser gateway error " + resp.statusCode() + ": " + body)))
                .bodyToMono(BrowserSessionResponse.class));
        if (created == null || created.sessionId() == null || created.sessionId().isBlank()) {
            throw new RenderException("Browser gateway returned no session id");
        }
        LOGGER.debug("Browser session opened id={} viewport={}x{}", created.sessionId(), viewport.width(), viewport.height());
        return new RemoteSession(created.sessionId());
    }

    private <T> T call(String step, Duration timeout, Mono<T> request) {
        try {
            return request.timeout(timeout).block();
        } catch (RenderException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new RenderException("Browser " + step + " timed out after " + timeout.toMillis() + " ms", cause);
            }
            throw new RenderException("Browser " + step + " failed: " + cause.getMessage(), cause);
        }
    }

    private final class RemoteSession implements RenderSession {
        private final String sessionId;

        private RemoteSession(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void navigate(URI pageUrl, Duration timeout) {
            call("navigate", timeout, client.post()
                    .uri("/sessions/{id}/navigate", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "url", pageUrl.toString(),
                            "waitUntil", "networkidle0",
                            "timeoutMs", timeout.toMillis()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RenderException("Navigation to " + pageUrl + " failed " + resp.statusCode() + ": " + body)))
                    .toBodilessEntity());
        }

        @Override
        public void awaitCondition(String expression, Duration timeout) {
            WaitForFunctionResponse result = call("wait", timeout.plusSeconds(5), client.post()
                    .uri("/sessions/{id}/wait-for-function", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("expression", expression, "timeoutMs", timeout.toMillis()))
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.REQUEST_TIMEOUT.value(), resp -> resp.releaseBody()
                            .then(Mono.just(new RenderException("Render did not finish within " + timeout.toMillis() + " ms"))))
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RenderException("Waiting for render failed " + resp.statusCode() + ": " + body)))
                    .bodyToMono(WaitForFunctionResponse.class));
            if (result == null || !result.finished()) {
                throw new RenderException("Render did not finish within " + timeout.toMillis() + " ms");
            }
        }

        @Override
        public byte[] captureTransparentPng(Duration timeout) {
            byte[] png = call("screenshot", timeout, client.post()
                    .uri("/sessions/{id}/screenshot", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.IMAGE_PNG)
                    .bodyValue(Map.of("type", "png", "omitBackground", true))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RenderException("Screenshot failed " + resp.statusCode() + ": " + body)))
                    .bodyToMono(byte[].class));
            if (png == null || png.length == 0) {
                throw new RenderException("Screenshot was empty");
            }
            return png;
        }

        @Override
        public void close() {
            try {
                client.delete()
                        .uri("/sessions/{id}", sessionId)
                        .retrieve()
                        .toBodilessEntity()
                        .block(CLOSE_TIMEOUT);
                LOGGER.debug("Browser session closed id={}", sessionId);
            } catch (RuntimeException e) {
                LOGGER.warn("Browser session close failed id={} err={}", sessionId, e.toString());
            }
        }
    }
}
