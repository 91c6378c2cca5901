package com.issuesextractor.scraper;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for exporting issues to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads the existing file, when there is one, and indexes its rows by Title.</li>
 *   <li>Updates rows whose Title matches an incoming issue; a {@code N/A} never overwrites a known value.</li>
 *   <li>Appends issues with new titles and stamps every touched row with {@code Last Updated}.</li>
 *   <li>Rewrites the file with the registry columns in registry order.</li>
 * </ul>
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class CsvService implements IssueSinkInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    public static final String LAST_UPDATED = "Last Updated";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path outputDir;
    private final Clock clock;

    public CsvService() {
        this(Paths.get("scraped-data"), Clock.systemDefaultZone());
    }

    public CsvService(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    @Override
    public UpsertResult upsertIssues(List<IssueRecord> issues, String filename) throws IOException {
        if (issues == null) {
            logger.warn("Attempted to write null issue list to CSV: {}", filename);
            throw new IllegalArgumentException("Issue list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(Utils.sanitizeFilename(filename));

        Map<String, Map<String, String>> rows = readExisting(file);
        String now = LocalDateTime.now(clock).format(TIMESTAMP);
        int inserted = 0;
        int updated = 0;
        for (IssueRecord issue : issues) {
            String title = issue.title();
            Map<String, String> existing = rows.get(title);
            if (existing == null) {
                Map<String, String> row = new LinkedHashMap<>(issue.fields());
                row.put(LAST_UPDATED, now);
                rows.put(title, row);
                inserted++;
            } else {
                issue.fields().forEach((field, value) -> {
                    if (!IssueNormalizer.NOT_AVAILABLE.equals(value) || !existing.containsKey(field)) {
                        existing.put(field, value);
                    }
                });
                existing.put(LAST_UPDATED, now);
                updated++;
            }
        }
        write(file, rows.values());
        logger.info("Upserted {} issues into {} ({} new, {} updated, {} rows total)",
            issues.size(), file, inserted, updated, rows.size());
        return new UpsertResult(inserted, updated);
    }

    private Map<String, Map<String, String>> readExisting(Path file) throws IOException {
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        if (!Files.exists(file)) return rows;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8); CSVReader reader = new CSVReader(in)) {
            List<String[]> all = reader.readAll();
            if (all.isEmpty()) return rows;
            String[] header = all.get(0);
            for (int r = 1; r < all.size(); r++) {
                String[] line = all.get(r);
                Map<String, String> row = new LinkedHashMap<>();
                for (int c = 0; c < header.length && c < line.length; c++) row.put(header[c], line[c]);
                String title = row.get(IssueFieldRegistry.TITLE);
                if (title != null && !title.isBlank()) rows.put(title, row);
            }
            logger.debug("Read {} existing issues from {}", rows.size(), file);
        } catch (CsvException e) {
            throw new IOException("Malformed CSV file " + file + ": " + e.getMessage(), e);
        }
        return rows;
    }

    private void write(Path file, Iterable<Map<String, String>> rows) throws IOException {
        List<String> columns = new ArrayList<>(IssueFieldRegistry.getFieldNames());
        columns.add(LAST_UPDATED);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8); CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(columns.toArray(String[]::new));
            for (Map<String, String> row : rows) {
                String[] line = new String[columns.size()];
                for (int i = 0; i < columns.size(); i++) line[i] = safe(row.get(columns.get(i)));
                writer.writeNext(line);
            }
        }
    }

    /**
     * Safely converts a value for CSV output, collapsing any CR/LF characters into a single space.
     * @param s Input string
     * @return Sanitized string
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
