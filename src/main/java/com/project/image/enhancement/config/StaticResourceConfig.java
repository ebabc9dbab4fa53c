package com.project.image.enhancement.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Explicit resource handlers for /uploads/** and /processed/** pointing at the configured
 * directories, so the URLs resolve regardless of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final StorageProperties storageProperties;

    public StaticResourceConfig(StorageProperties storageProperties) {
        this.storageProperties = storageProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(storageProperties.uploadDir()));
        registry.addResourceHandler("/processed/**")
                .addResourceLocations(location(storageProperties.processedDir()));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}
