package com.project.image.enhancement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param defaultIntensity initial position of the intensity slider, in percent
 * @param maxDimension     largest width or height the engine decodes; bigger images fall back
 */
@ConfigurationProperties(prefix = "app.enhancement")
public record EnhancementProperties(
        @DefaultValue("100") int defaultIntensity,
        @DefaultValue("4000") int maxDimension) {
}
