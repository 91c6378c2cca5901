package com.issuesextractor.scraper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record representing one extracted issue: a flat, ordered field-to-value mapping.
 *
 * @param fields field values in registry order
 */
public record IssueRecord(Map<String, String> fields) {

    public IssueRecord {
        if (fields == null) throw new IllegalArgumentException("fields cannot be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String get(String field) {
        return fields.get(field);
    }

    public String title() {
        return fields.getOrDefault(IssueFieldRegistry.TITLE, "");
    }
}
