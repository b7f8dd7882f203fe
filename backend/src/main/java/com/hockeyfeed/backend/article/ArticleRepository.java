package com.hockeyfeed.backend.article;

import com.hockeyfeed.backend.model.entity.Article;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {
    Optional<Article> findByOriginUrl(String originUrl);

    Page<Article> findByCategory(String category, Pageable pageable);

    Optional<Article> findTopByOrderByScrapedAtDescIdDesc();
}
