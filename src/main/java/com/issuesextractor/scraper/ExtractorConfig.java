package com.issuesextractor.scraper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables consumed by the extraction engine: timeouts, loop budgets and probe limits.
 * <p>
 * Values come from, in increasing priority:
 * <ul>
 *   <li>the defaults declared here,</li>
 *   <li>an optional JSON file bound with Jackson (unknown keys are ignored),</li>
 *   <li>environment variables, then system properties, for the handful of keys operators tune per run.</li>
 * </ul>
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractorConfig {
    private static final Logger logger = LoggerFactory.getLogger(ExtractorConfig.class);

    private long actionTimeoutMs = 20_000;
    private long navigationTimeoutMs = 60_000;
    private int maxScrollIterations = 100;
    private int stagnationThreshold = 25;
    private Integer targetCountOverride;
    private long settleDelayMs = 200;
    private long maxSettleDelayMs = 1_000;
    private int staleRetryCount = 3;
    private long staleRetryBackoffMs = 250;
    private int pagingKeyInterval = 3;
    private int showMoreInterval = 5;
    private int maxPages = 20;
    private int countMultiplier = 2;
    private int countCeiling = 5_000;
    private int defaultTargetEstimate = 100;
    private int maxValueLength = 1_000;
    private boolean openIssuesTab = true;
    private boolean selectAllColumns = true;
    private boolean headless = true;
    private String locatorsFile;
    private String storageStatePath = "scraped-data/storage-state.json";

    public ExtractorConfig() {}

    /**
     * Loads configuration from an optional JSON file and applies env/property overrides.
     * @param file JSON config file, may be null
     * @return resolved configuration
     */
    public static ExtractorConfig load(Path file) {
        ExtractorConfig config = new ExtractorConfig();
        if (file != null) {
            if (Files.exists(file)) {
                try {
                    config = new ObjectMapper().readValue(file.toFile(), ExtractorConfig.class);
                    logger.info("Loaded extractor configuration from {}", file);
                } catch (IOException e) {
                    throw new UncheckedIOException("Invalid extractor configuration file " + file, e);
                }
            } else {
                logger.warn("Configuration file {} not found; using defaults.", file);
            }
        }
        config.applyOverrides();
        return config;
    }

    /**
     * Applies overrides from environment variables or system properties.
     */
    void applyOverrides() {
        maxScrollIterations = intOrDefault("EXTRACTOR_MAX_ITERATIONS", maxScrollIterations);
        stagnationThreshold = intOrDefault("EXTRACTOR_STAGNATION_THRESHOLD", stagnationThreshold);
        maxPages = intOrDefault("EXTRACTOR_MAX_PAGES", maxPages);
        String target = envOrProp("EXTRACTOR_TARGET_COUNT", null);
        if (target != null && !target.isBlank()) {
            try {
                targetCountOverride = Integer.parseInt(target.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric EXTRACTOR_TARGET_COUNT '{}'", target);
            }
        }
        headless = Boolean.parseBoolean(envOrProp("EXTRACTOR_HEADLESS", Boolean.toString(headless)));
        locatorsFile = envOrProp("EXTRACTOR_LOCATORS", locatorsFile);
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    private static int intOrDefault(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}='{}'", key, raw);
            return defaultVal;
        }
    }

    public long getActionTimeoutMs() { return actionTimeoutMs; }
    public void setActionTimeoutMs(long actionTimeoutMs) { this.actionTimeoutMs = actionTimeoutMs; }

    public long getNavigationTimeoutMs() { return navigationTimeoutMs; }
    public void setNavigationTimeoutMs(long navigationTimeoutMs) { this.navigationTimeoutMs = navigationTimeoutMs; }

    public int getMaxScrollIterations() { return maxScrollIterations; }
    public void setMaxScrollIterations(int maxScrollIterations) { this.maxScrollIterations = maxScrollIterations; }

    public int getStagnationThreshold() { return stagnationThreshold; }
    public void setStagnationThreshold(int stagnationThreshold) { this.stagnationThreshold = stagnationThreshold; }

    public Integer getTargetCountOverride() { return targetCountOverride; }
    public void setTargetCountOverride(Integer targetCountOverride) { this.targetCountOverride = targetCountOverride; }

    public long getSettleDelayMs() { return settleDelayMs; }
    public void setSettleDelayMs(long settleDelayMs) { this.settleDelayMs = settleDelayMs; }

    public long getMaxSettleDelayMs() { return maxSettleDelayMs; }
    public void setMaxSettleDelayMs(long maxSettleDelayMs) { this.maxSettleDelayMs = maxSettleDelayMs; }

    public int getStaleRetryCount() { return staleRetryCount; }
    public void setStaleRetryCount(int staleRetryCount) { this.staleRetryCount = staleRetryCount; }

    public long getStaleRetryBackoffMs() { return staleRetryBackoffMs; }
    public void setStaleRetryBackoffMs(long staleRetryBackoffMs) { this.staleRetryBackoffMs = staleRetryBackoffMs; }

    public int getPagingKeyInterval() { return pagingKeyInterval; }
    public void setPagingKeyInterval(int pagingKeyInterval) { this.pagingKeyInterval = pagingKeyInterval; }

    public int getShowMoreInterval() { return showMoreInterval; }
    public void setShowMoreInterval(int showMoreInterval) { this.showMoreInterval = showMoreInterval; }

    public int getMaxPages() { return maxPages; }
    public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

    public int getCountMultiplier() { return countMultiplier; }
    public void setCountMultiplier(int countMultiplier) { this.countMultiplier = countMultiplier; }

    public int getCountCeiling() { return countCeiling; }
    public void setCountCeiling(int countCeiling) { this.countCeiling = countCeiling; }

    public int getDefaultTargetEstimate() { return defaultTargetEstimate; }
    public void setDefaultTargetEstimate(int defaultTargetEstimate) { this.defaultTargetEstimate = defaultTargetEstimate; }

    public int getMaxValueLength() { return maxValueLength; }
    public void setMaxValueLength(int maxValueLength) { this.maxValueLength = maxValueLength; }

    public boolean isOpenIssuesTab() { return openIssuesTab; }
    public void setOpenIssuesTab(boolean openIssuesTab) { this.openIssuesTab = openIssuesTab; }

    public boolean isSelectAllColumns() { return selectAllColumns; }
    public void setSelectAllColumns(boolean selectAllColumns) { this.selectAllColumns = selectAllColumns; }

    public boolean isHeadless() { return headless; }
    public void setHeadless(boolean headless) { this.headless = headless; }

    public String getLocatorsFile() { return locatorsFile; }
    public void setLocatorsFile(String locatorsFile) { this.locatorsFile = locatorsFile; }

    public String getStorageStatePath() { return storageStatePath; }
    public void setStorageStatePath(String storageStatePath) { this.storageStatePath = storageStatePath; }
}
