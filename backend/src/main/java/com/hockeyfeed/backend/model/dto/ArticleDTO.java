package com.hockeyfeed.backend.model.dto;

import com.hockeyfeed.backend.model.entity.Article;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * List view of a stored article (no body text)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArticleDTO {
    private Long id;
    private String category;
    private String originUrl;
    private String title;
    private String metaText;
    private String imageUrl;
    private LocalDateTime scrapedAt;

    public static ArticleDTO from(Article article) {
        return new ArticleDTO(article.getId(), article.getCategory(), article.getOriginUrl(),
                article.getTitle(), article.getMetaText(), article.getImageUrl(), article.getScrapedAt());
    }
}
