package com.hockeyfeed.backend.config;

import com.hockeyfeed.backend.model.enums.Category;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Site description loaded from {@code site-sources.yml}.
 * <p>
 * Selectors are listed in priority order (most specific first). Keeping them out
 * of the code lets the scraper follow markup changes on the source site with a
 * config edit.
 */
@Data
public class SiteConfig {
    private String name;
    private String baseUrl;
    private String robotsPath = "/robots.txt";

    // Processed in insertion order
    private Map<Category, String> listings = new LinkedHashMap<>();

    private Listing listing = new Listing();
    private Detail detail = new Detail();

    public String getRobotsUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return robotsPath.startsWith("/") ? base + robotsPath : base + "/" + robotsPath;
    }

    /**
     * Get the host part of the base URL
     */
    public String getDomain() {
        if (baseUrl == null) return null;
        return baseUrl.replaceAll("https?://", "").replaceAll("/.*", "").toLowerCase();
    }

    @Data
    public static class Listing {
        private String articlePathPrefix = "/sk/article/";
        private int minSlugLength = 8;
        private List<String> deniedSlugs = List.of();
        private List<String> tileSelectors = List.of();
    }

    @Data
    public static class Detail {
        private List<String> titleSelectors = List.of("h1");
        private List<String> metaSelectors = List.of();
        private List<String> gallerySelectors = List.of();
        private List<String> heroImageSelectors = List.of();
        private List<String> contentSelectors = List.of();
        private String contentBlockSelector = "p, h2, h3, li";
        private List<String> imageAttributes = List.of("src", "data-src", "data-original", "data-lazy-src");
    }
}
