package com.example.modelvault_backend.config;

import com.example.modelvault_backend.service.LocalAssetStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Files;
import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator assetStoreHealth(LocalAssetStore store) {
        return () -> {
            var root = store.root();
            if (Files.isDirectory(root) && Files.isWritable(root)) {
                return Health.up().withDetail("assetStore", root.toString()).build();
            }
            return Health.down().withDetail("assetStore", "not writable: " + root).build();
        };
    }

    @Bean
    public HealthIndicator browserGatewayHealth(@Qualifier("browserWebClient") WebClient browser) {
        return () -> {
            try {
                // any 2xx on HEAD / counts as up
                browser.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("browserGateway", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("browserGateway", "unreachable").build();
            }
        };
    }
}
