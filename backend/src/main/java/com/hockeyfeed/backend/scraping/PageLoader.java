package com.hockeyfeed.backend.scraping;

import java.io.IOException;
import lombok.Value;

/**
 * Single HTTP GET without retries. HTTP error statuses are returned, not thrown.
 */
@FunctionalInterface
public interface PageLoader {

    PageResponse load(String url) throws IOException;

    @Value
    class PageResponse {
        int statusCode;
        String body;
    }
}
