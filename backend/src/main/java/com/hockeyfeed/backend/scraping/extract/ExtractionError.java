package com.hockeyfeed.backend.scraping.extract;

/**
 * Why a detail page did not produce an item.
 */
public enum ExtractionError {
    MISSING_TITLE,
    MISSING_CONTENT_CONTAINER,
    // page parsed fine but is an info/static page rather than an article
    CONTENT_TOO_SHORT
}
