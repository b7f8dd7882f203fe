package com.hockeyfeed.backend.startup;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.exception.ScrapeRunInProgressException;
import com.hockeyfeed.backend.scraping.ScrapeJobService;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Runs the scraper periodically with a fixed delay between the end of one run
 * and the start of the next.
 */
@Component
@ConditionalOnProperty(name = "scraping.schedule.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ScrapeScheduler implements SchedulingConfigurer {

    static final Duration MIN_INTERVAL = Duration.ofSeconds(60);

    private final ScrapeJobService scrapeJobService;
    private final ScrapingConfig scrapingConfig;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = effectiveInterval(scrapingConfig.getSchedule().getInterval());
        Duration initialDelay = scrapingConfig.getSchedule().getInitialDelay();
        if (initialDelay == null || initialDelay.isNegative()) {
            initialDelay = Duration.ZERO;
        }
        log.info("Scheduling scrape runs every {} (first run in {})", interval, initialDelay);
        registrar.addFixedDelayTask(new FixedDelayTask(this::runScheduled, interval, initialDelay));
    }

    void runScheduled() {
        try {
            scrapeJobService.runNow();
        } catch (ScrapeRunInProgressException e) {
            log.info("Previous scrape run still in progress, skipping this tick");
        } catch (Exception e) {
            log.error("Scheduled scrape run failed: {}", e.getMessage(), e);
        }
    }

    static Duration effectiveInterval(Duration configured) {
        if (configured == null || configured.compareTo(MIN_INTERVAL) < 0) {
            return MIN_INTERVAL;
        }
        return configured;
    }
}
