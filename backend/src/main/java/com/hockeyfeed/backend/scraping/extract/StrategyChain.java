package com.hockeyfeed.backend.scraping.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

/**
 * Ordered list of strategies; the first one that finds a value wins.
 */
@Slf4j
public final class StrategyChain<T> {

    private final String name;
    private final List<Step<T>> steps;

    private StrategyChain(String name, List<Step<T>> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Chain of CSS selectors tried in order, returning the first matching element
     */
    public static StrategyChain<Element> ofSelectors(String name, List<String> selectors) {
        Builder<Element> builder = builder(name);
        if (selectors != null) {
            for (String selector : selectors) {
                builder.then(selector, selectFirst(selector));
            }
        }
        return builder.build();
    }

    public static ExtractionStrategy<Element> selectFirst(String selector) {
        return scope -> {
            try {
                return Optional.ofNullable(scope.selectFirst(selector));
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                log.debug("Invalid selector '{}': {}", selector, e.getMessage());
                return Optional.empty();
            }
        };
    }

    public Optional<T> first(Element scope) {
        if (scope == null) {
            return Optional.empty();
        }
        for (Step<T> step : steps) {
            Optional<T> found = step.getStrategy().extract(scope);
            if (found.isPresent()) {
                log.debug("{}: matched by '{}'", name, step.getLabel());
                return found;
            }
        }
        log.debug("{}: no strategy matched", name);
        return Optional.empty();
    }

    // labels are for logging only and may repeat
    @Value
    private static class Step<T> {
        String label;
        ExtractionStrategy<T> strategy;
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> then(String label, ExtractionStrategy<T> strategy) {
            steps.add(new Step<>(label, strategy));
            return this;
        }

        public StrategyChain<T> build() {
            return new StrategyChain<>(name, steps);
        }
    }
}
