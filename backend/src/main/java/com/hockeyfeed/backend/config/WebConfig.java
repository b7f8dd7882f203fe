package com.hockeyfeed.backend.config;

import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for browser frontends reading the article API.
 * {@code app.cors-origins} is a comma-separated list, {@code *} allows any origin.
 */
@Configuration
@Slf4j
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${app.cors-origins:*}") String corsOrigins) {
        this.allowedOrigins = Arrays.stream(corsOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        log.info("CORS allowed origins: {}", Arrays.toString(allowedOrigins));
        for (String pattern : new String[]{"/api/**", "/health"}) {
            registry.addMapping(pattern)
                    .allowedOrigins(allowedOrigins)
                    .allowedMethods("GET", "POST", "OPTIONS")
                    .allowedHeaders("*")
                    .allowCredentials(false);
        }
    }
}
