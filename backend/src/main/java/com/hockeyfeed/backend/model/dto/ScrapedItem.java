package com.hockeyfeed.backend.model.dto;

import com.hockeyfeed.backend.model.enums.Category;
import lombok.Builder;
import lombok.Value;

/**
 * Fields extracted from one article detail page.
 * <p>
 * {@code metaText} and {@code imageUrl} are null when the page has none; blank
 * values are turned into null so "missing" has a single representation.
 */
@Value
public class ScrapedItem {
    String originUrl;
    Category category;
    String title;
    String metaText;
    String imageUrl;
    String contentText;

    @Builder(toBuilder = true)
    public ScrapedItem(String originUrl, Category category, String title,
                       String metaText, String imageUrl, String contentText) {
        this.originUrl = originUrl;
        this.category = category;
        this.title = blankToNull(title);
        this.metaText = blankToNull(metaText);
        this.imageUrl = blankToNull(imageUrl);
        this.contentText = blankToNull(contentText);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
