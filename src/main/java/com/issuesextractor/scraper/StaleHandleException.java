package com.issuesextractor.scraper;

/**
 * Raised when an {@link ElementHandle} no longer points at a live node because the host
 * application re-rendered between resolution and use.
 * <p>
 * Callers re-resolve the target instead of retrying the same handle.
 */
public class StaleHandleException extends RuntimeException {
    public StaleHandleException(String message) {
        super(message);
    }

    public StaleHandleException(String message, Throwable cause) {
        super(message, cause);
    }
}
