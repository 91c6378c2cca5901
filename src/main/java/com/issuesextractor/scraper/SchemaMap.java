package com.issuesextractor.scraper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping from field name to column index, built once per extraction run.
 * Fields absent from the map are unmapped and extract as {@code N/A}.
 */
public final class SchemaMap {

    /** Index returned for unmapped fields. */
    public static final int UNMAPPED = -1;

    /** How the mapping was obtained. */
    public enum Source { HEADER, POSITIONAL, CONTENT }

    private final Map<String, Integer> columns;
    private final List<String> unmatchedHeaders;
    private final Source source;

    public SchemaMap(Map<String, Integer> columns, List<String> unmatchedHeaders, Source source) {
        if (columns == null || !columns.containsKey(IssueFieldRegistry.TITLE)) {
            throw new IllegalArgumentException("SchemaMap must map " + IssueFieldRegistry.TITLE);
        }
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.unmatchedHeaders = unmatchedHeaders == null ? List.of() : List.copyOf(unmatchedHeaders);
        this.source = source;
    }

    /**
     * @return the column index of a field, or {@link #UNMAPPED}
     */
    public int indexOf(String field) {
        Integer idx = columns.get(field);
        return idx == null ? UNMAPPED : idx;
    }

    public boolean isMapped(String field) {
        return columns.containsKey(field);
    }

    public Map<String, Integer> columns() {
        return columns;
    }

    public List<String> unmatchedHeaders() {
        return unmatchedHeaders;
    }

    public Source source() {
        return source;
    }

    @Override
    public String toString() {
        return "SchemaMap" + columns + " (" + source + ", unmatched=" + unmatchedHeaders + ")";
    }
}
