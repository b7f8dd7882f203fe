package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.SiteConfig;
import com.hockeyfeed.backend.model.enums.Category;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads the scraped site's listings and selectors from YAML
 */
@Service
@Slf4j
public class SiteConfigService {

    private final Resource configResource;
    private SiteConfig siteConfig;

    public SiteConfigService(@Value("classpath:site-sources.yml") Resource configResource) {
        this.configResource = configResource;
    }

    @PostConstruct
    public void loadConfiguration() {
        try (InputStream inputStream = configResource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);

            @SuppressWarnings("unchecked")
            Map<String, Object> site = (Map<String, Object>) data.get("site");
            if (site == null) {
                throw new IllegalStateException("Missing 'site' section");
            }

            siteConfig = createConfigFromMap(site);
            if (siteConfig.getBaseUrl() == null || siteConfig.getListings().isEmpty()) {
                throw new IllegalStateException("Site config needs baseUrl and at least one listing");
            }
            log.info("Loaded site configuration for {} with {} listings: {}",
                    siteConfig.getName(), siteConfig.getListings().size(), siteConfig.getListings().keySet());

        } catch (Exception e) {
            log.error("Error loading site configuration", e);
            throw new IllegalStateException("Failed to load site configuration", e);
        }
    }

    public SiteConfig getConfig() {
        return siteConfig;
    }

    @SuppressWarnings("unchecked")
    private SiteConfig createConfigFromMap(Map<String, Object> site) {
        SiteConfig config = new SiteConfig();
        config.setName((String) site.get("name"));
        config.setBaseUrl((String) site.get("baseUrl"));
        if (site.get("robotsPath") != null) {
            config.setRobotsPath((String) site.get("robotsPath"));
        }

        Map<String, Object> listings = (Map<String, Object>) site.get("listings");
        if (listings != null) {
            // SnakeYAML keeps mapping order, which is the processing order
            for (Map.Entry<String, Object> entry : listings.entrySet()) {
                Category category = Category.fromSlug(entry.getKey());
                config.getListings().put(category, String.valueOf(entry.getValue()));
            }
        }

        Map<String, Object> listing = (Map<String, Object>) site.get("listing");
        if (listing != null) {
            SiteConfig.Listing l = config.getListing();
            setIfPresent(listing, "articlePathPrefix", v -> l.setArticlePathPrefix((String) v));
            setIfPresent(listing, "minSlugLength", v -> l.setMinSlugLength(((Number) v).intValue()));
            setIfPresent(listing, "deniedSlugs", v -> l.setDeniedSlugs((List<String>) v));
            setIfPresent(listing, "tileSelectors", v -> l.setTileSelectors((List<String>) v));
        }

        Map<String, Object> detail = (Map<String, Object>) site.get("detail");
        if (detail != null) {
            SiteConfig.Detail d = config.getDetail();
            setIfPresent(detail, "titleSelectors", v -> d.setTitleSelectors((List<String>) v));
            setIfPresent(detail, "metaSelectors", v -> d.setMetaSelectors((List<String>) v));
            setIfPresent(detail, "gallerySelectors", v -> d.setGallerySelectors((List<String>) v));
            setIfPresent(detail, "heroImageSelectors", v -> d.setHeroImageSelectors((List<String>) v));
            setIfPresent(detail, "contentSelectors", v -> d.setContentSelectors((List<String>) v));
            setIfPresent(detail, "contentBlockSelector", v -> d.setContentBlockSelector((String) v));
            setIfPresent(detail, "imageAttributes", v -> d.setImageAttributes((List<String>) v));
        }

        return config;
    }

    private static void setIfPresent(Map<String, Object> map, String key, Consumer<Object> setter) {
        Object value = map.get(key);
        if (value != null) {
            setter.accept(value);
        }
    }
}
