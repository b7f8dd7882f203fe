package com.hockeyfeed.backend.scraping.extract;

import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * One way of finding a value inside an element. An empty result hands over to
 * the next strategy of the chain.
 */
@FunctionalInterface
public interface ExtractionStrategy<T> {
    Optional<T> extract(Element scope);
}
