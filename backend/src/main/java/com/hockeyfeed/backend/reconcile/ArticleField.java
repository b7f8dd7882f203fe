package com.hockeyfeed.backend.reconcile;

import com.hockeyfeed.backend.model.entity.Article;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Article fields that a re-scrape may fill or improve. {@code originUrl} is the
 * key and never changes; {@code scrapedAt} follows from the other fields.
 */
public enum ArticleField {
    CATEGORY(Article::getCategory, Article::setCategory),
    TITLE(Article::getTitle, Article::setTitle),
    META_TEXT(Article::getMetaText, Article::setMetaText),
    IMAGE_URL(Article::getImageUrl, Article::setImageUrl),
    CONTENT_TEXT(Article::getContentText, Article::setContentText);

    private final Function<Article, String> getter;
    private final BiConsumer<Article, String> setter;

    ArticleField(Function<Article, String> getter, BiConsumer<Article, String> setter) {
        this.getter = getter;
        this.setter = setter;
    }

    public String get(Article article) {
        return getter.apply(article);
    }

    public void set(Article article, String value) {
        setter.accept(article, value);
    }
}
