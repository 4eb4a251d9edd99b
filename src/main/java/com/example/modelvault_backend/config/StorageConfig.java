package com.example.modelvault_backend.config;

import com.example.modelvault_backend.service.LocalAssetStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public LocalAssetStore assetStore(StorageProperties properties) {
        if (!StringUtils.hasText(properties.getPublicBaseUrl())) {
            throw new IllegalStateException("storage.local.public-base-url must be set");
        }
        return new LocalAssetStore(Path.of(properties.getBaseDir()), properties.getPublicBaseUrl());
    }
}
