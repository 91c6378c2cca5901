package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Infers which column holds which issue field.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Header texts are uppercased and matched against the synonyms in {@link IssueFieldRegistry}:
 *       exact synonyms are assigned across all headers first, then the remaining headers take the
 *       longest synonym found at word boundaries.</li>
 *   <li>With no header, or fewer than {@link #MIN_HEADER_MATCHES} matches, the first eight canonical
 *       fields take their default positions and the remaining columns are classified by content
 *       (dates, status/priority labels, user ids).</li>
 *   <li>Title is always mapped, falling back to the first non-empty cell.</li>
 * </ul>
 * The result is computed once per run; per-row anomalies are left to {@link RowExtractor}.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class TableSchemaInference {
    private static final Logger logger = LoggerFactory.getLogger(TableSchemaInference.class);

    public static final int MIN_HEADER_MATCHES = 4;

    private final LocatorChain chain;
    private final LocatorCatalog catalog;
    private final RowCellResolver cellResolver;

    public TableSchemaInference(LocatorChain chain, LocatorCatalog catalog, RowCellResolver cellResolver) {
        this.chain = chain;
        this.catalog = catalog;
        this.cellResolver = cellResolver;
    }

    /**
     * Looks for the table header row.
     */
    public Optional<ElementHandle> findHeaderRow() {
        return chain.resolve(catalog.spec(LocatorTarget.HEADER_ROW), null);
    }

    /**
     * Infers the schema from live handles.
     * @param headerRow header row, or null when the table has none
     * @param sampleRows rendered rows; the first one that yields cells is the sample
     * @return schema with Title always mapped
     */
    public SchemaMap infer(ElementHandle headerRow, List<ElementHandle> sampleRows) {
        List<String> headers = null;
        if (headerRow != null) {
            try {
                headers = headerTexts(headerRow);
            } catch (StaleHandleException e) {
                logger.warn("Header row went stale before it could be read; inferring without it.");
            }
        }
        List<String> sample = List.of();
        for (ElementHandle row : sampleRows == null ? List.<ElementHandle>of() : sampleRows) {
            try {
                sample = cellResolver.cellTexts(row);
            } catch (StaleHandleException e) {
                logger.debug("Sample row went stale, trying the next one: {}", e.getMessage());
                continue;
            }
            if (!sample.isEmpty()) break;
        }
        return inferFromTexts(headers, sample);
    }

    /**
     * Infers the schema from header texts and one sample row's cell texts.
     * @param headerTexts header cell texts, or null when there is no header row
     * @param sampleCells cell texts of the representative row
     */
    public static SchemaMap inferFromTexts(List<String> headerTexts, List<String> sampleCells) {
        Map<String, Integer> mapped = new LinkedHashMap<>();
        Set<Integer> usedColumns = new HashSet<>();
        List<String> unmatched = new ArrayList<>();
        List<String> sample = sampleCells == null ? List.of() : sampleCells;
        SchemaMap.Source source = SchemaMap.Source.HEADER;

        if (headerTexts != null) {
            List<String> normalized = new ArrayList<>(headerTexts.size());
            for (String raw : headerTexts) normalized.add(normalizeHeader(raw));
            // Exact synonyms claim their fields before any word match can take them.
            for (int i = 0; i < normalized.size(); i++) {
                String field = exactHeaderMatch(normalized.get(i), mapped.keySet());
                if (field != null) {
                    mapped.put(field, i);
                    usedColumns.add(i);
                }
            }
            for (int i = 0; i < normalized.size(); i++) {
                if (usedColumns.contains(i) || normalized.get(i).isEmpty()) continue;
                String field = partialHeaderMatch(normalized.get(i), mapped.keySet());
                if (field != null) {
                    mapped.put(field, i);
                    usedColumns.add(i);
                } else {
                    unmatched.add(headerTexts.get(i).trim());
                }
            }
            logger.info("Header matched {} fields: {}; unmatched: {}", mapped.size(), mapped, unmatched);
        }

        if (headerTexts == null || mapped.size() < MIN_HEADER_MATCHES) {
            source = SchemaMap.Source.POSITIONAL;
            List<IssueField> fields = IssueFieldRegistry.canonicalFields();
            int positional = Math.min(fields.size(), sample.size());
            for (int col = 0; col < positional; col++) {
                String field = fields.get(col).fieldName;
                if (!mapped.containsKey(field) && !usedColumns.contains(col)) {
                    mapped.put(field, col);
                    usedColumns.add(col);
                }
            }
            for (int col = 0; col < sample.size(); col++) {
                if (usedColumns.contains(col)) continue;
                String field = classifyByContent(sample.get(col), mapped.keySet());
                if (field != null) {
                    mapped.put(field, col);
                    usedColumns.add(col);
                    source = SchemaMap.Source.CONTENT;
                }
            }
        }

        if (!mapped.containsKey(IssueFieldRegistry.TITLE)) {
            mapped.put(IssueFieldRegistry.TITLE, titleFallbackColumn(sample, usedColumns));
        }
        SchemaMap schema = new SchemaMap(mapped, unmatched, source);
        logger.info("Inferred schema: {}", schema);
        return schema;
    }

    // --- Header matching ---

    private List<String> headerTexts(ElementHandle headerRow) {
        QuerySpec spec = catalog.spec(LocatorTarget.HEADER_CELLS);
        for (Query query : spec.strategies()) {
            List<ElementHandle> cells = chain.runQuery(spec, query, headerRow);
            if (cells.isEmpty()) continue;
            List<String> texts = new ArrayList<>(cells.size());
            for (ElementHandle cell : cells) texts.add(cellResolver.valueOf(RowCellResolver.Cell.of(cell)));
            return texts;
        }
        logger.debug("Header row present but no header cell strategy matched");
        return List.of();
    }

    static String normalizeHeader(String header) {
        if (header == null) return "";
        return Utils.collapseWhitespace(header).replaceAll("[:*]+$", "").trim().toUpperCase(Locale.ROOT);
    }

    static String exactHeaderMatch(String normalized, Set<String> taken) {
        for (IssueField field : IssueFieldRegistry.getFields()) {
            if (taken.contains(field.fieldName)) continue;
            if (field.synonyms.contains(normalized)) return field.fieldName;
        }
        return null;
    }

    /**
     * @return the free field whose longest synonym appears in the header at word boundaries, or null
     */
    static String partialHeaderMatch(String normalized, Set<String> taken) {
        String best = null;
        int bestLength = 0;
        for (IssueField field : IssueFieldRegistry.getFields()) {
            if (taken.contains(field.fieldName)) continue;
            for (String synonym : field.synonyms) {
                if (synonym.length() > bestLength && containsWord(normalized, synonym)) {
                    best = field.fieldName;
                    bestLength = synonym.length();
                }
            }
        }
        return best;
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("(^|[^\\p{L}\\p{N}])" + Pattern.quote(word) + "([^\\p{L}\\p{N}]|$)").matcher(text).find();
    }

    // --- Content heuristics ---

    private static String classifyByContent(String value, Set<String> taken) {
        if (value == null || value.isBlank()) return null;
        String first = Utils.firstLine(value).replace("Object Status", "").trim();
        if (ValuePatterns.looksLikeDate(first)) {
            return firstFree(IssueField.Kind.DATE, taken);
        }
        if (ValuePatterns.exactStatus(first) != null && !taken.contains(IssueFieldRegistry.STATUS)) {
            return IssueFieldRegistry.STATUS;
        }
        if (ValuePatterns.exactPriority(first) != null && !taken.contains(IssueFieldRegistry.PRIORITY)) {
            return IssueFieldRegistry.PRIORITY;
        }
        if (ValuePatterns.looksLikeUserId(first)) {
            return firstFree(IssueField.Kind.USER, taken);
        }
        return null;
    }

    private static String firstFree(IssueField.Kind kind, Set<String> taken) {
        for (IssueField f : IssueFieldRegistry.fieldsOfKind(kind)) {
            if (!taken.contains(f.fieldName)) return f.fieldName;
        }
        return null;
    }

    private static int titleFallbackColumn(List<String> sample, Set<Integer> usedColumns) {
        int firstNonEmpty = -1;
        for (int i = 0; i < sample.size(); i++) {
            if (sample.get(i) == null || sample.get(i).isBlank()) continue;
            if (!usedColumns.contains(i)) return i;
            if (firstNonEmpty < 0) firstNonEmpty = i;
        }
        return Math.max(firstNonEmpty, 0);
    }
}
