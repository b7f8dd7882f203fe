package com.hockeyfeed.backend.reconcile;

import com.hockeyfeed.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of comparing a scraped item with the stored article.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReconciliationDecision {

    public enum Action {
        INSERT,
        UPDATE,
        NO_OP
    }

    private final Action action;
    // set for INSERT only
    private final Article newArticle;
    // set for UPDATE only, never empty there
    private final Map<ArticleField, String> changes;
    private final LocalDateTime timestamp;

    public static ReconciliationDecision insert(Article article) {
        return new ReconciliationDecision(Action.INSERT, article, Map.of(), article.getScrapedAt());
    }

    public static ReconciliationDecision update(EnumMap<ArticleField, String> changes, LocalDateTime now) {
        if (changes.isEmpty()) {
            throw new IllegalArgumentException("An update needs at least one changed field");
        }
        return new ReconciliationDecision(Action.UPDATE, null,
                Collections.unmodifiableMap(new EnumMap<>(changes)), now);
    }

    public static ReconciliationDecision noOp() {
        return new ReconciliationDecision(Action.NO_OP, null, Map.of(), null);
    }

    @Override
    public String toString() {
        switch (action) {
            case INSERT:
                return "Insert(" + newArticle.getOriginUrl() + ")";
            case UPDATE:
                return "Update(" + changes.keySet() + ")";
            default:
                return "NoOp";
        }
    }
}
