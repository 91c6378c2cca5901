package com.issuesextractor.scraper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Duplicate statistics of one run. Informational only: no row is ever dropped because of it.
 *
 * @param duplicateTitleCount number of distinct titles that appear more than once
 * @param duplicateSignatureCount number of rows identical in every field to an earlier row
 * @param titleOccurrences occurrence count of each duplicated title, in first-seen order
 */
public record DuplicateReport(int duplicateTitleCount, int duplicateSignatureCount, Map<String, Integer> titleOccurrences) {

    public DuplicateReport {
        titleOccurrences = titleOccurrences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(titleOccurrences));
    }

    public static DuplicateReport empty() {
        return new DuplicateReport(0, 0, Map.of());
    }
}
