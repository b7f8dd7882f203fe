package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.article.ArticleService;
import com.hockeyfeed.backend.exception.FetchException;
import com.hockeyfeed.backend.model.dto.ListingCandidate;
import com.hockeyfeed.backend.model.dto.ScrapeRunSummary;
import com.hockeyfeed.backend.model.dto.ScrapedItem;
import com.hockeyfeed.backend.model.entity.Article;
import com.hockeyfeed.backend.model.enums.Category;
import com.hockeyfeed.backend.reconcile.ReconciliationDecision;
import com.hockeyfeed.backend.reconcile.ReconciliationEngine;
import com.hockeyfeed.backend.scraping.extract.ExtractionError;
import com.hockeyfeed.backend.scraping.extract.ExtractionResult;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * One scrape run: robots.txt, then every configured category listing, then each
 * listed article, strictly one request at a time.
 * <p>
 * Per-item failures are counted and the run moves on. Only an unreachable
 * database aborts the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrapeOrchestrator {

    private final PoliteHttpClient httpClient;
    private final RobotsGate robotsGate;
    private final ListingExtractor listingExtractor;
    private final DetailExtractor detailExtractor;
    private final ReconciliationEngine reconciliationEngine;
    private final ArticleService articleService;
    private final SiteConfigService siteConfigService;
    private final Clock clock;

    public ScrapeRunSummary run() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        RunCounters counters = new RunCounters();
        log.info("🚀 Starting scrape run for {}", siteConfigService.getConfig().getName());

        RobotsPolicy robots;
        try {
            robots = robotsGate.build();
        } catch (FetchException e) {
            log.error("Could not load robots.txt, ending run: {}", e.getMessage());
            counters.errors++;
            return finish(startedAt, counters);
        }

        for (Map.Entry<Category, String> listing : siteConfigService.getConfig().getListings().entrySet()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Scrape run interrupted, skipping remaining categories");
                break;
            }
            scrapeCategory(listing.getKey(), listing.getValue(), robots, startedAt, counters);
        }

        return finish(startedAt, counters);
    }

    private void scrapeCategory(Category category, String listingUrl, RobotsPolicy robots,
                                LocalDateTime now, RunCounters counters) {
        if (!robots.allows(listingUrl)) {
            log.warn("robots.txt disallows listing {} ({}), skipping category", listingUrl, category.getSlug());
            counters.errors++;
            return;
        }

        List<ListingCandidate> candidates;
        try {
            String listingHtml = httpClient.fetch(listingUrl);
            candidates = listingExtractor.extract(listingHtml, listingUrl);
        } catch (FetchException e) {
            log.warn("Listing {} failed, skipping category: {}", listingUrl, e.getMessage());
            counters.errors++;
            return;
        } catch (RuntimeException e) {
            log.warn("Could not parse listing {}, skipping category: {}", listingUrl, e.getMessage());
            counters.errors++;
            return;
        }

        log.info("Category {}: {} candidate articles", category.getSlug(), candidates.size());
        RunCounters before = counters.copy();
        for (ListingCandidate candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                processCandidate(category, candidate, robots, now, counters);
            } catch (DataAccessResourceFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected failure on {}: {}", candidate.getOriginUrl(), e.getMessage(), e);
                counters.errors++;
            }
        }
        log.info("Category {} done: scanned={}, inserted={}, updated={}, unchanged={}, skipped={}, errors={}",
                category.getSlug(),
                counters.scanned - before.scanned,
                counters.inserted - before.inserted,
                counters.updated - before.updated,
                counters.unchanged - before.unchanged,
                counters.skipped - before.skipped,
                counters.errors - before.errors);
    }

    private void processCandidate(Category category, ListingCandidate candidate, RobotsPolicy robots,
                                  LocalDateTime now, RunCounters counters) {
        String url = candidate.getOriginUrl();
        if (!robots.allows(url)) {
            log.debug("robots.txt disallows {}, skipped", url);
            return;
        }

        counters.scanned++;
        String html;
        try {
            html = httpClient.fetch(url);
        } catch (FetchException e) {
            log.warn("Skipping {}: {}", url, e.getMessage());
            counters.errors++;
            return;
        }

        ExtractionResult<ScrapedItem> result = detailExtractor.extract(html, url, category);
        if (!result.isSuccess()) {
            if (result.getError() == ExtractionError.CONTENT_TOO_SHORT) {
                log.debug("Skipping non-article page: {}", result.getMessage());
                counters.skipped++;
            } else {
                log.warn("Skipping {} ({}): {}", url, result.getError(), result.getMessage());
                counters.errors++;
            }
            return;
        }

        ScrapedItem item = result.getValue();
        if (item.getImageUrl() == null && candidate.getImageUrl() != null) {
            item = item.toBuilder().imageUrl(candidate.getImageUrl()).build();
        }
        commit(item, now, counters);
    }

    /**
     * Reconcile one item against the stored article and write the outcome
     */
    void commit(ScrapedItem item, LocalDateTime now, RunCounters counters) {
        try {
            Article existing = articleService.findByUrl(item.getOriginUrl()).orElse(null);
            ReconciliationDecision decision = reconciliationEngine.reconcile(existing, item, now);

            switch (decision.getAction()) {
                case INSERT:
                    try {
                        articleService.insert(decision.getNewArticle());
                        counters.inserted++;
                    } catch (DataIntegrityViolationException e) {
                        // inserted by someone else since the lookup
                        log.debug("Article {} already stored, leaving it unchanged", item.getOriginUrl());
                        counters.unchanged++;
                    }
                    break;
                case UPDATE:
                    articleService.update(existing, decision.getChanges(), decision.getTimestamp());
                    counters.updated++;
                    break;
                default:
                    log.debug("No changes for {}", item.getOriginUrl());
                    counters.unchanged++;
            }
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            log.error("Failed to store {}: {}", item.getOriginUrl(), e.getMessage(), e);
            counters.errors++;
        }
    }

    private ScrapeRunSummary finish(LocalDateTime startedAt, RunCounters counters) {
        LocalDateTime finishedAt = LocalDateTime.now(clock);
        ScrapeRunSummary summary = ScrapeRunSummary.builder()
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationSeconds(Duration.between(startedAt, finishedAt).toMillis() / 1000.0)
                .scanned(counters.scanned)
                .inserted(counters.inserted)
                .updated(counters.updated)
                .unchanged(counters.unchanged)
                .skipped(counters.skipped)
                .errors(counters.errors)
                .build();
        log.info("✅ Scrape run finished in {}s: scanned={}, inserted={}, updated={}, unchanged={}, skipped={}, errors={}",
                summary.getDurationSeconds(), summary.getScanned(), summary.getInserted(), summary.getUpdated(),
                summary.getUnchanged(), summary.getSkipped(), summary.getErrors());
        return summary;
    }

    static final class RunCounters {
        int scanned;
        int inserted;
        int updated;
        int unchanged;
        int skipped;
        int errors;

        RunCounters copy() {
            RunCounters copy = new RunCounters();
            copy.scanned = scanned;
            copy.inserted = inserted;
            copy.updated = updated;
            copy.unchanged = unchanged;
            copy.skipped = skipped;
            copy.errors = errors;
            return copy;
        }
    }
}
