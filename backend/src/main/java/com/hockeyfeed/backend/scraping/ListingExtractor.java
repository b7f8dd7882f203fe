package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.config.SiteConfig;
import com.hockeyfeed.backend.model.dto.ListingCandidate;
import com.hockeyfeed.backend.scraping.extract.StrategyChain;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Service;

/**
 * Finds article links on a category listing page
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ListingExtractor {

    private static final Pattern BACKGROUND_IMAGE =
            Pattern.compile("background(?:-image)?\\s*:[^;]*url\\(\\s*['\"]?([^'\")]+?)['\"]?\\s*\\)",
                    Pattern.CASE_INSENSITIVE);

    private final SiteConfigService siteConfigService;
    private final ScrapingConfig scrapingConfig;

    /**
     * Extract article candidates from listing HTML, newest first as the page lists them.
     * Duplicates are dropped and the result is capped at {@code maxArticlesPerRun}.
     */
    public List<ListingCandidate> extract(String listingHtml, String listingUrl) {
        Document doc = Jsoup.parse(listingHtml == null ? "" : listingHtml, listingUrl);
        SiteConfig.Listing rules = siteConfigService.getConfig().getListing();

        StrategyChain<List<ListingCandidate>> chain = StrategyChain.<List<ListingCandidate>>builder("listing")
                .then("article tiles", scope -> nonEmpty(fromTiles(scope, rules, listingUrl)))
                .then("article path prefix", scope -> nonEmpty(fromAnchors(scope, listingUrl)))
                .build();

        List<ListingCandidate> raw = chain.first(doc).orElse(List.of());
        List<ListingCandidate> candidates = dedupeAndCap(raw, Math.max(0, scrapingConfig.getMaxArticlesPerRun()));
        log.debug("Listing {}: {} raw links, {} candidates", listingUrl, raw.size(), candidates.size());
        return candidates;
    }

    /**
     * Whether a URL looks like an article detail page of the configured site
     */
    public boolean isLikelyArticleUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        SiteConfig site = siteConfigService.getConfig();
        SiteConfig.Listing rules = site.getListing();

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            return false;
        }
        if (!sameHost(uri.getHost(), site.getDomain())) {
            return false;
        }

        String path = uri.getPath();
        String prefix = rules.getArticlePathPrefix();
        if (path == null || !path.startsWith(prefix)) {
            return false;
        }

        String slug = path.substring(prefix.length());
        while (slug.endsWith("/")) {
            slug = slug.substring(0, slug.length() - 1);
        }
        if (slug.length() < rules.getMinSlugLength()) {
            return false;
        }
        String lowerSlug = slug.toLowerCase(Locale.ROOT);
        return rules.getDeniedSlugs().stream().noneMatch(denied -> denied.equalsIgnoreCase(lowerSlug));
    }

    private List<ListingCandidate> fromTiles(Element doc, SiteConfig.Listing rules, String listingUrl) {
        List<ListingCandidate> found = new ArrayList<>();
        for (Element tile : selectTiles(doc, rules.getTileSelectors())) {
            String hint = backgroundImageHint(tile, listingUrl);
            for (Element anchor : tile.select("a[href]")) {
                String url = canonicalize(anchor.absUrl("href"));
                if (isLikelyArticleUrl(url)) {
                    found.add(new ListingCandidate(url, hint));
                }
            }
        }
        return found;
    }

    private List<ListingCandidate> fromAnchors(Element doc, String listingUrl) {
        List<ListingCandidate> found = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String url = canonicalize(anchor.absUrl("href"));
            if (isLikelyArticleUrl(url)) {
                found.add(new ListingCandidate(url, backgroundImageHint(anchor, listingUrl)));
            }
        }
        return found;
    }

    private Elements selectTiles(Element doc, List<String> tileSelectors) {
        if (tileSelectors == null || tileSelectors.isEmpty()) {
            return new Elements();
        }
        // one combined query keeps document order and drops tiles matched twice
        try {
            return doc.select(String.join(", ", tileSelectors));
        } catch (Selector.SelectorParseException e) {
            log.warn("Invalid tile selectors {}: {}", tileSelectors, e.getMessage());
            return new Elements();
        }
    }

    /**
     * First {@code background-image: url(...)} on the element or its descendants, resolved absolute
     */
    String backgroundImageHint(Element element, String baseUrl) {
        // select() includes the element itself when it carries a style
        for (Element el : element.select("[style]")) {
            String style = el.attr("style");
            if (style.isEmpty()) {
                continue;
            }
            Matcher matcher = BACKGROUND_IMAGE.matcher(style);
            if (matcher.find()) {
                String resolved = resolve(baseUrl, matcher.group(1).trim());
                if (resolved != null) {
                    return resolved;
                }
            }
        }
        return null;
    }

    private static List<ListingCandidate> dedupeAndCap(List<ListingCandidate> raw, int limit) {
        Map<String, ListingCandidate> unique = new LinkedHashMap<>();
        for (ListingCandidate candidate : raw) {
            ListingCandidate seen = unique.get(candidate.getOriginUrl());
            if (seen == null) {
                unique.put(candidate.getOriginUrl(), candidate);
            } else if (seen.getImageUrl() == null && candidate.getImageUrl() != null) {
                unique.put(candidate.getOriginUrl(), seen.withImageUrl(candidate.getImageUrl()));
            }
        }
        List<ListingCandidate> ordered = new ArrayList<>(unique.values());
        return ordered.subList(0, Math.min(limit, ordered.size()));
    }

    private static Optional<List<ListingCandidate>> nonEmpty(List<ListingCandidate> candidates) {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates);
    }

    /**
     * Drop the fragment; returns null for unparsable URLs
     */
    static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            trimmed = trimmed.substring(0, hash);
        }
        try {
            return new URI(trimmed).toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String resolve(String baseUrl, String relative) {
        try {
            return new URI(baseUrl).resolve(relative.replace(" ", "%20")).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot resolve image hint '{}' against {}", relative, baseUrl);
            return null;
        }
    }

    private static boolean sameHost(String host, String siteDomain) {
        if (host == null || siteDomain == null) {
            return false;
        }
        return stripWww(host).equalsIgnoreCase(stripWww(siteDomain));
    }

    private static String stripWww(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }
}
