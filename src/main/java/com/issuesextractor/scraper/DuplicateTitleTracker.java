package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Counts duplicate titles and identical rows across an extraction run.
 * <p>
 * Rows that share a title are all kept: the counts are reported so downstream consumers can
 * choose their own policy. Re-scroll or pagination overlap shows up as identical signatures.
 */
public class DuplicateTitleTracker {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateTitleTracker.class);

    private final Map<String, Integer> titleCounts = new LinkedHashMap<>();
    private final Set<String> signatures = new HashSet<>();
    private int duplicateSignatures;

    /**
     * Records one extracted row.
     * @return the row's identity signature
     */
    public String track(IssueRecord record) {
        titleCounts.merge(record.title(), 1, Integer::sum);
        String signature = signature(record);
        if (!signatures.add(signature)) {
            duplicateSignatures++;
            logger.debug("Row identical to an earlier one: '{}'", record.title());
        }
        return signature;
    }

    public DuplicateReport report() {
        Map<String, Integer> duplicated = new LinkedHashMap<>();
        titleCounts.forEach((title, count) -> {
            if (count > 1) duplicated.put(title, count);
        });
        if (!duplicated.isEmpty()) {
            logger.info("{} titles appear more than once (all rows kept): {}", duplicated.size(), duplicated);
        }
        return new DuplicateReport(duplicated.size(), duplicateSignatures, duplicated);
    }

    /**
     * Stable SHA-256 signature over every field of a record, in field order.
     */
    public static String signature(IssueRecord record) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : record.fields().entrySet()) {
            sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\u001F');
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
