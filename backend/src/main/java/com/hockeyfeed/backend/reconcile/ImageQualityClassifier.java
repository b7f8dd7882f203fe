package com.hockeyfeed.backend.reconcile;

import com.hockeyfeed.backend.config.ScrapingConfig;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Tells full-size editorial images (uploads, gallery) apart from thumbnails and
 * placeholders, by URL substring.
 */
@Component
@RequiredArgsConstructor
public class ImageQualityClassifier {

    private final ScrapingConfig scrapingConfig;

    public boolean isHighQuality(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return false;
        }
        List<String> patterns = scrapingConfig.getHighQualityImagePatterns();
        if (patterns == null) {
            return false;
        }
        return patterns.stream().anyMatch(imageUrl::contains);
    }
}
