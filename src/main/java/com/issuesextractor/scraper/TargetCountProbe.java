package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort estimate of how many rows the data set holds.
 * <p>
 * Sources, in order: a configured override, a count badge ("Issues (123)" or a bare number),
 * an "N of M" caption, and finally a multiplier over the visible rows clamped between the default
 * estimate and a safety ceiling.
 */
public class TargetCountProbe {
    private static final Logger logger = LoggerFactory.getLogger(TargetCountProbe.class);

    private static final Pattern PARENTHESIZED = Pattern.compile("\\((\\d+)\\)");
    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\s*(\\d+)\\s*$");
    private static final Pattern OF_TOTAL = Pattern.compile("(?i)\\b(?:of|de)\\s+(\\d+)\\b");

    private final LocatorChain chain;
    private final LocatorCatalog catalog;
    private final IssueRowFinder rowFinder;
    private final ExtractorConfig config;

    public TargetCountProbe(LocatorChain chain, LocatorCatalog catalog, IssueRowFinder rowFinder, ExtractorConfig config) {
        this.chain = chain;
        this.catalog = catalog;
        this.rowFinder = rowFinder;
        this.config = config;
    }

    /**
     * @return the estimated number of rows, always at least 1
     */
    public int estimate() {
        Integer override = config.getTargetCountOverride();
        if (override != null && override > 0) {
            logger.info("Using configured target count {}", override);
            return override;
        }
        OptionalInt badge = readBadge();
        if (badge.isPresent()) {
            logger.info("Target count {} read from count badge", badge.getAsInt());
            return badge.getAsInt();
        }
        OptionalInt caption = readCaption();
        if (caption.isPresent()) {
            logger.info("Target count {} read from caption", caption.getAsInt());
            return caption.getAsInt();
        }
        int visible = rowFinder.countRows();
        int estimate = fallbackEstimate(visible);
        logger.info("No count indicator found; estimating {} from {} visible rows", estimate, visible);
        return estimate;
    }

    int fallbackEstimate(int visibleRows) {
        long scaled = (long) visibleRows * Math.max(1, config.getCountMultiplier());
        long floored = Math.max(scaled, config.getDefaultTargetEstimate());
        return (int) Math.max(1, Math.min(floored, config.getCountCeiling()));
    }

    private OptionalInt readBadge() {
        for (ElementHandle badge : chain.resolveAll(catalog.spec(LocatorTarget.COUNT_BADGE), null)) {
            OptionalInt n = parseBadge(safeText(badge));
            if (n.isPresent()) return n;
        }
        return OptionalInt.empty();
    }

    private OptionalInt readCaption() {
        for (ElementHandle caption : chain.resolveAll(catalog.spec(LocatorTarget.COUNT_CAPTION), null)) {
            OptionalInt n = parseCaption(safeText(caption));
            if (n.isPresent()) return n;
        }
        return OptionalInt.empty();
    }

    static OptionalInt parseBadge(String text) {
        if (text == null) return OptionalInt.empty();
        Matcher m = PARENTHESIZED.matcher(text);
        if (m.find()) return positive(m.group(1));
        m = DIGITS_ONLY.matcher(text);
        if (m.find()) return positive(m.group(1));
        return OptionalInt.empty();
    }

    static OptionalInt parseCaption(String text) {
        if (text == null) return OptionalInt.empty();
        Matcher m = OF_TOTAL.matcher(text);
        return m.find() ? positive(m.group(1)) : OptionalInt.empty();
    }

    private static OptionalInt positive(String digits) {
        try {
            int n = Integer.parseInt(digits);
            return n > 0 ? OptionalInt.of(n) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            logger.debug("Count '{}' is not a usable number", digits);
            return OptionalInt.empty();
        }
    }

    private static String safeText(ElementHandle e) {
        try {
            return e.text();
        } catch (StaleHandleException ex) {
            logger.debug("Count indicator went stale: {}", ex.getMessage());
            return null;
        }
    }
}
