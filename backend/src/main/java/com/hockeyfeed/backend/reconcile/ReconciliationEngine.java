package com.hockeyfeed.backend.reconcile;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.model.dto.ScrapedItem;
import com.hockeyfeed.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.EnumMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Decides how a freshly scraped item changes the stored article.
 * <p>
 * Stored values are only ever filled or improved: a field is never blanked and
 * never replaced by something judged worse. Nothing here touches the database.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final ScrapingConfig scrapingConfig;
    private final ImageQualityClassifier imageQualityClassifier;

    /**
     * @param existing stored article with the item's origin URL, or null when there is none
     */
    public ReconciliationDecision reconcile(Article existing, ScrapedItem item, LocalDateTime now) {
        if (existing == null) {
            return ReconciliationDecision.insert(newArticle(item, now));
        }

        EnumMap<ArticleField, String> changes = new EnumMap<>(ArticleField.class);
        String category = item.getCategory() != null ? item.getCategory().getSlug() : null;

        fillIfBlank(changes, ArticleField.CATEGORY, existing.getCategory(), category);
        fillIfBlank(changes, ArticleField.TITLE, existing.getTitle(), item.getTitle());
        fillIfBlank(changes, ArticleField.META_TEXT, existing.getMetaText(), item.getMetaText());

        if (shouldReplaceImage(existing.getImageUrl(), item.getImageUrl())) {
            changes.put(ArticleField.IMAGE_URL, item.getImageUrl());
        }
        if (shouldReplaceContent(existing.getContentText(), item.getContentText())) {
            changes.put(ArticleField.CONTENT_TEXT, item.getContentText());
        }

        return changes.isEmpty() ? ReconciliationDecision.noOp() : ReconciliationDecision.update(changes, now);
    }

    boolean shouldReplaceImage(String existing, String candidate) {
        if (isBlank(candidate)) {
            return false;
        }
        if (isBlank(existing)) {
            return true;
        }
        return imageQualityClassifier.isHighQuality(candidate) && !candidate.equals(existing);
    }

    boolean shouldReplaceContent(String existing, String candidate) {
        if (isBlank(candidate)) {
            return false;
        }
        if (isBlank(existing)) {
            return true;
        }
        return candidate.length() > existing.length() + scrapingConfig.getContentImproveMargin();
    }

    private static void fillIfBlank(EnumMap<ArticleField, String> changes, ArticleField field,
                                    String existing, String candidate) {
        if (isBlank(existing) && !isBlank(candidate)) {
            changes.put(field, candidate);
        }
    }

    private static Article newArticle(ScrapedItem item, LocalDateTime now) {
        return Article.builder()
                .originUrl(item.getOriginUrl())
                .category(item.getCategory().getSlug())
                .title(item.getTitle())
                .metaText(item.getMetaText())
                .imageUrl(item.getImageUrl())
                .contentText(item.getContentText())
                .scrapedAt(now)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
