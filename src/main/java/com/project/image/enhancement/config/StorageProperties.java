package com.project.image.enhancement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Locations of the two storage areas: original uploads and processed results.
 * Bound once at startup and handed to whoever needs them.
 */
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
        @DefaultValue("uploads") String uploadDir,
        @DefaultValue("processed") String processedDir) {
}
