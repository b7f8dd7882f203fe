package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.config.SiteConfig;
import com.hockeyfeed.backend.exception.FetchException;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the site's robots.txt once per run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RobotsGate {

    private final PoliteHttpClient httpClient;
    private final SiteConfigService siteConfigService;
    private final ScrapingConfig scrapingConfig;

    /**
     * Fetch and parse robots.txt. A 404 or 410 means the site has no rules and
     * everything is allowed; any other failure is thrown to the caller.
     */
    public RobotsPolicy build() throws FetchException {
        SiteConfig site = siteConfigService.getConfig();
        String robotsUrl = site.getRobotsUrl();

        String body;
        try {
            body = httpClient.fetch(robotsUrl);
        } catch (FetchException e) {
            if (e.getStatusCode() == 404 || e.getStatusCode() == 410) {
                log.info("No robots.txt at {} (HTTP {}), all paths allowed", robotsUrl, e.getStatusCode());
                return RobotsPolicy.allowAll();
            }
            throw e;
        }

        SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
        SimpleRobotRules rules = parser.parseContent(robotsUrl, body.getBytes(StandardCharsets.UTF_8),
                "text/plain; charset=UTF-8", List.of(robotName(scrapingConfig.getUserAgent())));
        log.debug("Parsed robots.txt from {} for robot {}", robotsUrl, robotName(scrapingConfig.getUserAgent()));
        return new RobotsPolicy(rules);
    }

    /**
     * Product token of a User-Agent string, lower-cased: "Mozilla/5.0 (...)" gives "mozilla"
     */
    static String robotName(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return "*";
        }
        String token = userAgent.trim().split("[/\\s]", 2)[0];
        return token.toLowerCase(Locale.ROOT);
    }
}
