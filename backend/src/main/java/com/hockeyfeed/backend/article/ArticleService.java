package com.hockeyfeed.backend.article;

import com.hockeyfeed.backend.exception.ArticleNotFoundException;
import com.hockeyfeed.backend.model.dto.ArticleDTO;
import com.hockeyfeed.backend.model.dto.ArticleDetailDTO;
import com.hockeyfeed.backend.model.dto.HealthDTO;
import com.hockeyfeed.backend.model.entity.Article;
import com.hockeyfeed.backend.model.enums.Category;
import com.hockeyfeed.backend.reconcile.ArticleField;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stored articles: lookups and per-item writes for the scraper, read queries for the API.
 * <p>
 * Every write commits on its own; a failed item never rolls back another.
 */
@Service
@Slf4j
@Transactional
public class ArticleService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("scrapedAt"), Sort.Order.desc("id"));

    private final ArticleRepository articleRepository;
    private final String appName;

    public ArticleService(ArticleRepository articleRepository,
                          @Value("${app.name:hockeyslovakia-api-scraper}") String appName) {
        this.articleRepository = articleRepository;
        this.appName = appName;
    }

    @Transactional(readOnly = true)
    public Optional<Article> findByUrl(String originUrl) {
        return articleRepository.findByOriginUrl(originUrl);
    }

    /**
     * Insert a new article. A concurrent insert of the same URL surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    public Article insert(Article article) {
        Article saved = articleRepository.saveAndFlush(article);
        log.info("Inserted article {} ({})", saved.getId(), saved.getOriginUrl());
        return saved;
    }

    /**
     * Apply changed fields to a stored article. {@code scrapedAt} only moves forward.
     */
    public Article update(Article stored, Map<ArticleField, String> changes, LocalDateTime now) {
        changes.forEach((field, value) -> field.set(stored, value));
        if (stored.getScrapedAt() == null || now.isAfter(stored.getScrapedAt())) {
            stored.setScrapedAt(now);
        }
        Article saved = articleRepository.saveAndFlush(stored);
        log.info("Updated article {} ({}): {}", saved.getId(), saved.getOriginUrl(), changes.keySet());
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<ArticleDTO> getArticles(Category category, int page, int size) {
        Pageable pageable = PageRequest.of(page, size, NEWEST_FIRST);
        Page<Article> articles = category == null
                ? articleRepository.findAll(pageable)
                : articleRepository.findByCategory(category.getSlug(), pageable);
        return articles.map(ArticleDTO::from);
    }

    @Transactional(readOnly = true)
    public ArticleDetailDTO getArticle(Long id) {
        return articleRepository.findById(id)
                .map(ArticleDetailDTO::from)
                .orElseThrow(() -> new ArticleNotFoundException(id));
    }

    /**
     * Service status; {@code db} is false when the database cannot be queried.
     * Runs outside a transaction so a dead connection pool is reported, not thrown.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public HealthDTO health() {
        HealthDTO.HealthDTOBuilder health = HealthDTO.builder().ok(true).app(appName);
        try {
            long count = articleRepository.count();
            Optional<Article> latest = articleRepository.findTopByOrderByScrapedAtDescIdDesc();
            return health.db(true)
                    .articlesCount(count)
                    .lastScrapedAt(latest.map(Article::getScrapedAt).orElse(null))
                    .lastOriginUrl(latest.map(Article::getOriginUrl).orElse(null))
                    .build();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Health check could not query the database: {}", e.getMessage());
            return health.db(false).build();
        }
    }
}
