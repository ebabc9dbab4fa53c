package com.project.image.enhancement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the Spring Boot application. Bootstraps the web layer, storage and the
 * enhancement engine; it must NOT contain business logic.
 *
 * @ConfigurationPropertiesScan binds the typed app.* settings found in the config package.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
