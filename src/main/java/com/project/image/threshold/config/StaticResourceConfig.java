package com.project.image.threshold.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves saved results under /outputs/** straight from app.output.dir,
 * whatever the working directory is.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    // same setting and default as StorageService
    @Value("${app.output.dir:outputs}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path abs = Paths.get(outputDir).toAbsolutePath().normalize();
        registry.addResourceHandler("/outputs/**")
                .addResourceLocations("file:" + abs.toString() + "/");
    }
}
