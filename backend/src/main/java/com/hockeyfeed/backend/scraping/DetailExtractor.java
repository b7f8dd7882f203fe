package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.ScrapingConfig;
import com.hockeyfeed.backend.config.SiteConfig;
import com.hockeyfeed.backend.model.dto.ScrapedItem;
import com.hockeyfeed.backend.model.enums.Category;
import com.hockeyfeed.backend.scraping.extract.ExtractionError;
import com.hockeyfeed.backend.scraping.extract.ExtractionResult;
import com.hockeyfeed.backend.scraping.extract.ExtractionStrategy;
import com.hockeyfeed.backend.scraping.extract.StrategyChain;
import com.hockeyfeed.backend.scraping.extract.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Service;

/**
 * Extracts title, meta line, lead image and body text from an article detail page.
 * <p>
 * Every field is looked up through a chain of selectors from {@code site-sources.yml},
 * most specific first, so a markup change on one layout falls through to the
 * next candidate instead of losing the field.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DetailExtractor {

    private static final Set<String> NON_CONTENT_TAGS = Set.of("script", "style", "noscript", "template");

    private final SiteConfigService siteConfigService;
    private final ScrapingConfig scrapingConfig;

    public ExtractionResult<ScrapedItem> extract(String html, String url, Category category) {
        Document doc = Jsoup.parse(html == null ? "" : html, url);
        SiteConfig.Detail rules = siteConfigService.getConfig().getDetail();

        Optional<String> title = textChain("title", rules.getTitleSelectors()).first(doc);
        if (title.isEmpty()) {
            return ExtractionResult.failure(ExtractionError.MISSING_TITLE, "No title on " + url);
        }

        Optional<Element> content = StrategyChain.ofSelectors("content", rules.getContentSelectors()).first(doc);
        if (content.isEmpty()) {
            return ExtractionResult.failure(ExtractionError.MISSING_CONTENT_CONTAINER,
                    "No content container on " + url);
        }

        String contentText = extractBody(content.get(), rules.getContentBlockSelector());
        if (contentText.length() < scrapingConfig.getMinContentLength()) {
            return ExtractionResult.failure(ExtractionError.CONTENT_TOO_SHORT,
                    "Body has " + contentText.length() + " chars on " + url);
        }

        String metaText = textChain("meta", rules.getMetaSelectors()).first(doc).orElse(null);
        Element gallery = StrategyChain.ofSelectors("gallery", rules.getGallerySelectors()).first(doc).orElse(null);
        String imageUrl = imageChain(rules, gallery, content.get()).first(doc).orElse(null);

        ScrapedItem item = ScrapedItem.builder()
                .originUrl(url)
                .category(category)
                .title(title.get())
                .metaText(metaText)
                .imageUrl(imageUrl)
                .contentText(contentText)
                .build();

        log.debug("Extracted {}: title={}, image={}, content_length={}",
                url, title.get(), imageUrl, contentText.length());
        return ExtractionResult.success(item);
    }

    /**
     * Block elements joined by newlines; falls back to every visible text node of the container
     */
    String extractBody(Element container, String blockSelector) {
        List<String> parts = new ArrayList<>();
        try {
            for (Element block : container.select(blockSelector)) {
                String text = block.text().trim();
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
        } catch (Selector.SelectorParseException e) {
            log.warn("Invalid content block selector '{}': {}", blockSelector, e.getMessage());
        }

        if (parts.isEmpty()) {
            container.traverse((node, depth) -> {
                if (node instanceof TextNode && !insideNonContent(node)) {
                    String text = ((TextNode) node).text().trim();
                    if (!text.isEmpty()) {
                        parts.add(text);
                    }
                }
            });
        }
        return TextNormalizer.normalize(String.join("\n", parts));
    }

    /**
     * Hero image inside the gallery, then any gallery image, then any image in the body
     */
    private StrategyChain<String> imageChain(SiteConfig.Detail rules, Element gallery, Element content) {
        List<String> attributes = rules.getImageAttributes();
        StrategyChain.Builder<String> chain = StrategyChain.builder("image");
        for (String heroSelector : rules.getHeroImageSelectors()) {
            chain.then("gallery " + heroSelector, scope -> firstImage(gallery, heroSelector, attributes));
        }
        chain.then("gallery img", scope -> firstImage(gallery, "img", attributes));
        chain.then("content img", scope -> firstImage(content, "img", attributes));
        return chain.build();
    }

    private Optional<String> firstImage(Element scope, String selector, List<String> attributes) {
        if (scope == null) {
            return Optional.empty();
        }
        List<Element> images;
        try {
            images = scope.select(selector);
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid image selector '{}': {}", selector, e.getMessage());
            return Optional.empty();
        }
        for (Element img : images) {
            for (String attribute : attributes) {
                String raw = img.attr(attribute).trim();
                if (raw.isEmpty() || raw.startsWith("data:")) {
                    continue;
                }
                String absolute = img.absUrl(attribute);
                if (!absolute.isEmpty()) {
                    return Optional.of(absolute);
                }
            }
        }
        return Optional.empty();
    }

    private StrategyChain<String> textChain(String name, List<String> selectors) {
        StrategyChain.Builder<String> chain = StrategyChain.builder(name);
        for (String selector : selectors) {
            ExtractionStrategy<Element> element = StrategyChain.selectFirst(selector);
            chain.then(selector, scope -> element.extract(scope)
                    .map(el -> TextNormalizer.normalize(el.text()))
                    .filter(text -> !text.isEmpty()));
        }
        return chain.build();
    }

    private static boolean insideNonContent(Node node) {
        for (Node parent = node.parentNode(); parent != null; parent = parent.parentNode()) {
            if (parent instanceof Element && NON_CONTENT_TAGS.contains(((Element) parent).normalName())) {
                return true;
            }
        }
        return false;
    }
}
