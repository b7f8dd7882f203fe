package com.hockeyfeed.backend.scraping.extract;

import java.util.Objects;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Either an extracted value or the reason extraction failed.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExtractionResult<T> {

    private final T value;
    private final ExtractionError error;
    private final String message;

    public static <T> ExtractionResult<T> success(T value) {
        return new ExtractionResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ExtractionResult<T> failure(ExtractionError error, String message) {
        return new ExtractionResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + error + ": " + message + ")";
    }
}
