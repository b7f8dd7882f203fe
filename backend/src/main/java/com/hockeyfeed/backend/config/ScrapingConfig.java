package com.hockeyfeed.backend.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    // Politeness + limits
    private double delaySeconds = 2.5;
    private int timeoutSeconds = 20;
    private int maxArticlesPerRun = 10;

    // Retry with exponential backoff, clamped to [min, max]
    private int maxAttempts = 3;
    private double backoffMinSeconds = 1.0;
    private double backoffMaxSeconds = 8.0;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    // Sent with every request next to the User-Agent
    private Map<String, String> defaultHeaders = new LinkedHashMap<>(Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "sk-SK,sk;q=0.9,en;q=0.8"
    ));

    // Shorter bodies are info/static pages, not articles
    private int minContentLength = 150;

    // A re-scraped body must be this much longer to replace the stored one
    private int contentImproveMargin = 80;

    // Image URLs containing one of these are preferred over anything else
    private List<String> highQualityImagePatterns = List.of("/upload/", "/gallery/");

    private Schedule schedule = new Schedule();

    public Duration getDelay() {
        return Duration.ofMillis(Math.round(Math.max(0, delaySeconds) * 1000));
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        private Duration initialDelay = Duration.ofSeconds(10);
    }
}
