package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.exception.FetchException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * HTTP GET with retry/backoff and a minimum delay between consecutive requests.
 * <p>
 * Every page the scraper touches, robots.txt included, goes through this client
 * so the politeness delay holds for the whole run.
 */
@Component
@Slf4j
public class PoliteHttpClient {

    private final ScrapingConfig scrapingConfig;
    private final PageLoader pageLoader;
    private final Sleeper sleeper;
    private final Clock clock;

    // epoch millis when the previous fetch finished, -1 before the first one
    private long lastFetchFinishedAt = -1;

    public PoliteHttpClient(ScrapingConfig scrapingConfig, PageLoader pageLoader, Sleeper sleeper, Clock clock) {
        this.scrapingConfig = scrapingConfig;
        this.pageLoader = pageLoader;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Fetch the body of a page, retrying network failures and HTTP status >= 400
     */
    public synchronized String fetch(String url) throws FetchException {
        try {
            awaitPolitenessDelay(url);
            return fetchWithRetry(url);
        } finally {
            lastFetchFinishedAt = clock.millis();
        }
    }

    private String fetchWithRetry(String url) throws FetchException {
        int maxAttempts = Math.max(1, scrapingConfig.getMaxAttempts());
        int lastStatus = -1;
        IOException lastCause = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                PageLoader.PageResponse response = pageLoader.load(url);
                if (response.getStatusCode() < 400) {
                    log.debug("Fetched {} (HTTP {}, attempt {})", url, response.getStatusCode(), attempt);
                    return response.getBody() != null ? response.getBody() : "";
                }
                lastStatus = response.getStatusCode();
                lastCause = null;
                log.debug("HTTP {} for {} (attempt {}/{})", lastStatus, url, attempt, maxAttempts);
            } catch (IOException e) {
                lastStatus = -1;
                lastCause = e;
                log.debug("Network error for {} (attempt {}/{}): {}", url, attempt, maxAttempts, e.getMessage());
            } catch (UncheckedIOException e) {
                lastStatus = -1;
                lastCause = e.getCause();
                log.debug("Network error for {} (attempt {}/{}): {}", url, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                sleepOrFail(url, backoffDelay(attempt));
            }
        }

        log.warn("Giving up on {} after {} attempts (last status {})", url, maxAttempts, lastStatus);
        throw new FetchException(url, lastStatus, maxAttempts, lastCause);
    }

    /**
     * Delay before attempt {@code attempt + 1}: 1s, 2s, 4s, ... clamped to [min, max]
     */
    Duration backoffDelay(int attempt) {
        double min = scrapingConfig.getBackoffMinSeconds();
        double max = Math.max(min, scrapingConfig.getBackoffMaxSeconds());
        double seconds = min * Math.pow(2, attempt - 1);
        seconds = Math.min(max, Math.max(min, seconds));
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private void awaitPolitenessDelay(String url) throws FetchException {
        if (lastFetchFinishedAt < 0) {
            return;
        }
        long elapsed = clock.millis() - lastFetchFinishedAt;
        long remaining = scrapingConfig.getDelay().toMillis() - elapsed;
        if (remaining > 0) {
            sleepOrFail(url, Duration.ofMillis(remaining));
        }
    }

    private void sleepOrFail(String url, Duration duration) throws FetchException {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted while waiting", e);
        }
    }
}
