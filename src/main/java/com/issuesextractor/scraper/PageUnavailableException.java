package com.issuesextractor.scraper;

/**
 * Raised when the underlying page itself is unusable (browser closed, session lost).
 * This is the only failure that aborts an extraction run.
 */
public class PageUnavailableException extends RuntimeException {
    public PageUnavailableException(String message) {
        super(message);
    }

    public PageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
