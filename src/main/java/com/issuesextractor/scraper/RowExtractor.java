package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns one rendered row into an {@link IssueRecord}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Segments the row into cells and reads the cell each mapped field points at.</li>
 *   <li>Fills gaps with field-specific heuristics: title locators and the first text line for the
 *       title, color/class indicators for priority, vocabulary lines for status, date-looking lines
 *       for empty date fields.</li>
 *   <li>Normalizes the values; a row whose title is still empty is skipped.</li>
 * </ul>
 * Errors on one row never abort the batch: they are logged and the row is skipped. Only a dead
 * page ({@link PageUnavailableException}) propagates.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class RowExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RowExtractor.class);

    private static final List<Map.Entry<LocatorTarget, String>> PRIORITY_INDICATORS = List.of(
        Map.entry(LocatorTarget.PRIORITY_VERY_HIGH, "Very High"),
        Map.entry(LocatorTarget.PRIORITY_HIGH, "High"),
        Map.entry(LocatorTarget.PRIORITY_MEDIUM, "Medium"),
        Map.entry(LocatorTarget.PRIORITY_LOW, "Low")
    );

    private final LocatorChain chain;
    private final LocatorCatalog catalog;
    private final RowCellResolver cellResolver;
    private final IssueNormalizer normalizer;

    public RowExtractor(LocatorChain chain, LocatorCatalog catalog, RowCellResolver cellResolver, IssueNormalizer normalizer) {
        this.chain = chain;
        this.catalog = catalog;
        this.cellResolver = cellResolver;
        this.normalizer = normalizer;
    }

    /**
     * Extracts one row.
     * @param row live row handle
     * @param schema column mapping for this run
     * @return the record, or empty when the row is skipped
     */
    public Optional<IssueRecord> extract(ElementHandle row, SchemaMap schema) {
        try {
            return extractRow(row, schema);
        } catch (PageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Skipping row after extraction error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<IssueRecord> extractRow(ElementHandle row, SchemaMap schema) {
        List<RowCellResolver.Cell> cells = cellResolver.cells(row);
        List<String> lines = Utils.lines(row.text());

        Map<String, String> raw = new LinkedHashMap<>();
        for (IssueField field : IssueFieldRegistry.getFields()) {
            int idx = schema.indexOf(field.fieldName);
            String value = idx >= 0 && idx < cells.size() ? cellResolver.valueOf(cells.get(idx)) : "";
            raw.put(field.fieldName, value);
        }

        if (IssueNormalizer.cleanTitle(raw.get(IssueFieldRegistry.TITLE)).isEmpty()) {
            raw.put(IssueFieldRegistry.TITLE, titleFallback(row, lines));
        }
        if (ValuePatterns.canonicalPriority(raw.get(IssueFieldRegistry.PRIORITY)) == null) {
            String inferred = priorityFromRow(row, lines);
            if (inferred != null) raw.put(IssueFieldRegistry.PRIORITY, inferred);
        }
        if (ValuePatterns.canonicalStatus(IssueNormalizer.normalizeStatus(raw.get(IssueFieldRegistry.STATUS))) == null) {
            String inferred = statusFromLines(lines);
            if (inferred != null) raw.put(IssueFieldRegistry.STATUS, inferred);
        }
        fillDatesFromLines(raw, schema, lines);

        Map<String, String> normalized = normalizer.normalize(raw);
        if (normalized.get(IssueFieldRegistry.TITLE).isEmpty()) {
            logger.debug("Skipping title-less row: {}", lines);
            return Optional.empty();
        }
        return Optional.of(new IssueRecord(normalized));
    }

    // --- Field-specific fallbacks ---

    private String titleFallback(ElementHandle row, List<String> lines) {
        QuerySpec spec = catalog.spec(LocatorTarget.ROW_TITLE);
        for (Query query : spec.strategies()) {
            for (ElementHandle candidate : chain.runQuery(spec, query, row)) {
                String text = candidate.text();
                if (IssueNormalizer.cleanTitle(text).isEmpty()) text = candidate.attribute("title");
                if (!IssueNormalizer.cleanTitle(text).isEmpty()) return text;
            }
        }
        for (String line : lines) {
            if (!IssueNormalizer.cleanTitle(line).isEmpty()) return line;
        }
        return "";
    }

    private String priorityFromRow(ElementHandle row, List<String> lines) {
        for (Map.Entry<LocatorTarget, String> indicator : PRIORITY_INDICATORS) {
            QuerySpec spec = catalog.spec(indicator.getKey());
            for (Query query : spec.strategies()) {
                if (!chain.runQuery(spec, query, row).isEmpty()) {
                    logger.trace("Priority {} inferred from indicator {}", indicator.getValue(), query);
                    return indicator.getValue();
                }
            }
        }
        for (String line : lines) {
            String p = ValuePatterns.exactPriority(line);
            if (p != null) return p;
        }
        return null;
    }

    private static String statusFromLines(List<String> lines) {
        for (String line : lines) {
            String s = ValuePatterns.exactStatus(line.replace("Object Status", ""));
            if (s != null) return s;
        }
        return null;
    }

    private static void fillDatesFromLines(Map<String, String> raw, SchemaMap schema, List<String> lines) {
        Set<String> taken = new HashSet<>(raw.values());
        Iterator<String> candidates = lines.stream()
            .filter(ValuePatterns::looksLikeDate)
            .filter(line -> !taken.contains(line))
            .iterator();
        for (IssueField field : IssueFieldRegistry.fieldsOfKind(IssueField.Kind.DATE)) {
            if (!schema.isMapped(field.fieldName)) continue;
            if (!raw.get(field.fieldName).isBlank()) continue;
            if (!candidates.hasNext()) return;
            raw.put(field.fieldName, candidates.next());
        }
    }
}
