package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Utility class for common helper methods used in extraction and file operations.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Retries a page action up to maxAttempts times with exponential backoff.
     * <p>
     * {@link PageUnavailableException} is never retried: a dead page propagates immediately.
     * @param action Callable action to execute
     * @param maxAttempts Maximum number of attempts
     * @param backoffMs Delay before the second attempt; doubled for every further attempt
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retry(Callable<T> action, int maxAttempts, long backoffMs, String actionDesc) {
        int attempts = 0;
        while (attempts < maxAttempts) {
            try {
                return action.call();
            } catch (PageUnavailableException e) {
                throw e;
            } catch (Exception e) {
                attempts++;
                logger.warn("Failed {} (attempt {}/{}): {}", actionDesc, attempts, maxAttempts, e.getMessage());
                if (attempts >= maxAttempts) break;
                long delay = backoffMs * (1L << (attempts - 1));
                if (delay > 0) {
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        logger.warn("Interrupted while backing off {}; giving up.", actionDesc);
                        return null;
                    }
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxAttempts);
        return null;
    }

    // --- Text helpers ---

    /**
     * Collapses runs of whitespace (including line breaks) to single spaces and trims.
     */
    public static String collapseWhitespace(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }

    /**
     * Returns the non-blank, trimmed lines of a text block.
     */
    public static List<String> lines(String s) {
        List<String> out = new ArrayList<>();
        if (s == null) return out;
        for (String line : s.split("\\r?\\n")) {
            String t = line.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /**
     * Returns the first non-blank line of a text block, or an empty string.
     */
    public static String firstLine(String s) {
        List<String> all = lines(s);
        return all.isEmpty() ? "" : all.get(0);
    }
}
