package com.hockeyfeed.backend.controller;

import com.hockeyfeed.backend.model.dto.ScrapeRunSummary;
import com.hockeyfeed.backend.scraping.ScrapeJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scraping")
@RequiredArgsConstructor
@Slf4j
public class ScrapingController {

    private final ScrapeJobService scrapeJobService;

    /**
     * Run a scrape now and wait for its summary
     */
    @PostMapping("/run")
    public ResponseEntity<ScrapeRunSummary> run() {
        log.info("Manual scrape run requested");
        return ResponseEntity.ok(scrapeJobService.runNow());
    }

    @GetMapping("/last")
    public ResponseEntity<ScrapeRunSummary> last() {
        return scrapeJobService.getLastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
