package com.issuesextractor.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.issuesextractor.playwright.PlaywrightPageHandle;
import com.microsoft.playwright.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point for the issues extractor.
 * Opens the issues page in Playwright, extracts every issue and upserts them into a CSV file
 * under {@code scraped-data/}.
 * <p>
 * Usage: {@code Main <url> [--config extractor.json] [--out issues.csv]}
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_OUTPUT = "issues.csv";

    /**
     * Parsed command line.
     */
    record Arguments(String url, Path configFile, String output) {}

    /**
     * Parses command-line arguments.
     * @param args raw arguments
     * @return parsed arguments; url is null when none was given
     */
    static Arguments parseArgs(String[] args) {
        String url = null;
        Path config = null;
        String output = DEFAULT_OUTPUT;
        String envConfig = ExtractorConfig.envOrProp("EXTRACTOR_CONFIG", null);
        if (envConfig != null && !envConfig.isBlank()) config = Paths.get(envConfig);
        if (args != null) {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if ("--config".equals(a) && i + 1 < args.length) {
                    config = Paths.get(args[++i]);
                } else if ("--out".equals(a) && i + 1 < args.length) {
                    output = args[++i];
                } else if (!a.startsWith("--") && url == null) {
                    url = a.trim();
                } else {
                    logger.warn("Ignoring unrecognised argument: {}", a);
                }
            }
        }
        return new Arguments(url, config, output);
    }

    /**
     * Creates a browser context, restoring a saved storage state when the file looks valid.
     * Logging in is the session owner's job; a missing or broken state just starts fresh.
     */
    static BrowserContext createContext(Browser browser, ExtractorConfig config) {
        Browser.NewContextOptions options = new Browser.NewContextOptions().setViewportSize(1920, 1080);
        String storagePath = config.getStorageStatePath();
        Path storageFile = storagePath == null ? null : Paths.get(storagePath);
        if (storageFile != null && Files.exists(storageFile)) {
            try {
                String content = Files.readString(storageFile).trim();
                if (content.startsWith("{")) {
                    options.setStorageStatePath(storageFile);
                    logger.info("Using existing storage state from {} to restore session.", storageFile);
                } else {
                    logger.warn("Storage state {} is not JSON; starting a fresh context.", storageFile);
                }
            } catch (IOException e) {
                logger.warn("Failed to read storage state '{}': {}. Starting fresh.", storageFile, e.getMessage());
            }
        } else {
            logger.info("No existing storage state found; starting a fresh context.");
        }
        return browser.newContext(options);
    }

    /**
     * Navigates to the issues page, retrying transient failures.
     * @return false when every attempt failed
     */
    static boolean navigate(Page page, String url, long backoffMs) {
        Boolean loaded = Utils.retry(() -> {
            page.navigate(url);
            return Boolean.TRUE;
        }, 3, backoffMs, "navigate to issues page");
        return loaded != null;
    }

    /**
     * Writes a JSON summary of the run next to the CSV output.
     */
    static Path writeRunReport(ExtractionResult result, Path dir) throws IOException {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", result.status().name());
        report.put("rowsAttempted", result.rowsAttempted());
        report.put("rowsExtracted", result.rowsExtracted());
        report.put("rowsSkipped", result.rowsSkipped());
        report.put("duplicateTitles", result.duplicates().duplicateTitleCount());
        report.put("duplicateRows", result.duplicates().duplicateSignatureCount());
        report.put("duplicatedTitleOccurrences", result.duplicates().titleOccurrences());
        report.put("pages", result.pagesVisited());
        report.put("loads", result.loads());
        report.put("schema", result.schema() == null ? Map.of() : result.schema().columns());
        Files.createDirectories(dir);
        Path file = dir.resolve("run-report.json");
        new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), report);
        return file;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        Arguments arguments = parseArgs(args);
        if (arguments.url() == null || arguments.url().isBlank()) {
            System.out.println("Usage: Main <issues-url> [--config extractor.json] [--out issues.csv]");
            return;
        }
        ExtractorConfig config = ExtractorConfig.load(arguments.configFile());
        LocatorCatalog catalog = LocatorCatalog.load(
            config.getLocatorsFile() == null ? null : Paths.get(config.getLocatorsFile()));
        IssueSinkInterface sink = new CsvService();

        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));
            BrowserContext context = createContext(browser, config);
            Page page = context.newPage();
            page.setDefaultNavigationTimeout(config.getNavigationTimeoutMs());
            logger.info("Navigating to {}", arguments.url());
            if (!navigate(page, arguments.url(), 1_000)) {
                logger.error("Could not open {}; nothing extracted.", arguments.url());
                return;
            }
            try {
                page.waitForLoadState(com.microsoft.playwright.options.LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(config.getNavigationTimeoutMs()));
            } catch (TimeoutError e) {
                logger.warn("Network did not go idle within {} ms; continuing: {}", config.getNavigationTimeoutMs(), e.getMessage());
            }

            ExtractionServiceInterface extractor = new ExtractionService(
                new PlaywrightPageHandle(page, config.getActionTimeoutMs()), catalog, config, ExtractionProgressListener.logging());
            ExtractionResult result = extractor.run();

            if (result.status() == ExtractionResult.Status.EMPTY) {
                logger.warn("No issues extracted from {}", arguments.url());
            } else {
                IssueSinkInterface.UpsertResult upsert = sink.upsertIssues(result.records(), arguments.output());
                logger.info("Stored issues: {} new, {} updated", upsert.inserted(), upsert.updated());
            }
            Path report = writeRunReport(result, Paths.get("scraped-data"));
            logger.info("Run report written to {}", report);
            context.browser().close();
        } catch (PageUnavailableException e) {
            logger.error("Extraction aborted, page lost: {}", e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to write extraction output: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
        }
    }
}
