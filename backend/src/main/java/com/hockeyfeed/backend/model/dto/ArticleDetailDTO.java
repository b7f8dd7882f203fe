package com.hockeyfeed.backend.model.dto;

import com.hockeyfeed.backend.model.entity.Article;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ArticleDetailDTO extends ArticleDTO {
    private String contentText;

    public static ArticleDetailDTO from(Article article) {
        ArticleDetailDTO dto = new ArticleDetailDTO();
        dto.setId(article.getId());
        dto.setCategory(article.getCategory());
        dto.setOriginUrl(article.getOriginUrl());
        dto.setTitle(article.getTitle());
        dto.setMetaText(article.getMetaText());
        dto.setImageUrl(article.getImageUrl());
        dto.setScrapedAt(article.getScrapedAt());
        dto.setContentText(article.getContentText());
        return dto;
    }
}
