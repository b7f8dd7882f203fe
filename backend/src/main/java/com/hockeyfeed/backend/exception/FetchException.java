package com.hockeyfeed.backend.exception;

import lombok.Getter;

/**
 * A page could not be fetched after all retry attempts.
 */
@Getter
public class FetchException extends Exception {

    private final String url;
    // last HTTP status seen, -1 when the last attempt failed below HTTP
    private final int statusCode;
    private final int attempts;

    public FetchException(String url, int statusCode, int attempts, Throwable cause) {
        super(buildMessage(url, statusCode, attempts, cause), cause);
        this.url = url;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
        this.statusCode = -1;
        this.attempts = 0;
    }

    private static String buildMessage(String url, int statusCode, int attempts, Throwable cause) {
        String reason = statusCode >= 0 ? "HTTP " + statusCode
                : (cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "unknown error");
        return reason + " for " + url + " after " + attempts + " attempt(s)";
    }
}
