package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes raw extracted values into the canonical issue vocabulary.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Status keeps its first line, drops the "Object Status" label and maps onto the status vocabulary.</li>
 *   <li>Priority maps onto Very High / High / Medium / Low.</li>
 *   <li>Title loses expander labels ("Show more", "Mostrar menos", ...) and redundant whitespace.</li>
 *   <li>A Type equal to the Title is cleared; a date sitting in Created By moves to the first empty date field.</li>
 *   <li>Values are truncated to the configured maximum; empty non-title fields become {@code N/A}.</li>
 * </ul>
 * Unknown status or priority text is kept as-is. The pass is a fixed point: normalizing an
 * already normalized record returns it unchanged.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class IssueNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(IssueNormalizer.class);

    public static final String NOT_AVAILABLE = "N/A";
    private static final String ELLIPSIS = "...";

    private static final Pattern CONTROL_LABELS = Pattern.compile(
        "(?i)(?<![\\p{L}\\p{N}])(show more|show less|mostrar más|mostrar menos|mostrar mais|ver más|ver menos"
            + "|mehr anzeigen|weniger anzeigen|afficher plus|afficher moins)(?![\\p{L}\\p{N}])");

    private final int maxValueLength;

    public IssueNormalizer(int maxValueLength) {
        this.maxValueLength = Math.max(ELLIPSIS.length() + 1, maxValueLength);
    }

    /**
     * Normalizes a raw field map.
     * @param raw extracted values keyed by field name; missing fields count as empty
     * @return a new map holding every registry field in registry order
     */
    public Map<String, String> normalize(Map<String, String> raw) {
        Map<String, String> out = new LinkedHashMap<>();
        for (IssueField field : IssueFieldRegistry.getFields()) {
            String value = raw == null ? null : raw.get(field.fieldName);
            out.put(field.fieldName, normalizeValue(field, value));
        }
        applyCorrections(out);
        for (Map.Entry<String, String> entry : out.entrySet()) {
            if (entry.getValue().isEmpty() && !IssueFieldRegistry.TITLE.equals(entry.getKey())) {
                entry.setValue(NOT_AVAILABLE);
            }
        }
        return out;
    }

    /**
     * Normalizes an existing record; returns an equal record when it is already normalized.
     */
    public IssueRecord normalize(IssueRecord record) {
        return new IssueRecord(normalize(record.fields()));
    }

    /**
     * Removes expander labels from a title and collapses whitespace.
     */
    public static String cleanTitle(String title) {
        String current = Utils.collapseWhitespace(title);
        String previous;
        do {
            previous = current;
            current = Utils.collapseWhitespace(CONTROL_LABELS.matcher(current).replaceAll(" "));
        } while (!current.equals(previous));
        return current;
    }

    public static String normalizeStatus(String status) {
        String line = Utils.collapseWhitespace(Utils.firstLine(status).replace("Object Status", ""));
        String canonical = ValuePatterns.canonicalStatus(line);
        return canonical != null ? canonical : line;
    }

    public static String normalizePriority(String priority) {
        String value = Utils.collapseWhitespace(priority);
        String canonical = ValuePatterns.canonicalPriority(value);
        return canonical != null ? canonical : value;
    }

    private String normalizeValue(IssueField field, String value) {
        if (value == null) return "";
        return switch (field.kind) {
            case STATUS -> truncate(normalizeStatus(value));
            case PRIORITY -> truncate(normalizePriority(value));
            default -> IssueFieldRegistry.TITLE.equals(field.fieldName)
                ? cleanTitle(truncate(Utils.collapseWhitespace(value)))
                : truncate(Utils.collapseWhitespace(value));
        };
    }

    private void applyCorrections(Map<String, String> record) {
        String title = record.get(IssueFieldRegistry.TITLE);
        String type = record.get(IssueFieldRegistry.TYPE);
        if (!title.isEmpty() && title.equalsIgnoreCase(type)) {
            logger.debug("Type duplicated the title '{}'; clearing it.", title);
            record.put(IssueFieldRegistry.TYPE, "");
        }
        String createdBy = record.get(IssueFieldRegistry.CREATED_BY);
        if (ValuePatterns.looksLikeDate(createdBy) && !ValuePatterns.looksLikeUserId(createdBy)) {
            List<IssueField> dateFields = IssueFieldRegistry.fieldsOfKind(IssueField.Kind.DATE);
            for (IssueField dateField : dateFields) {
                String current = record.get(dateField.fieldName);
                if (current.isEmpty() || NOT_AVAILABLE.equals(current)) {
                    logger.debug("Moving date '{}' from {} to {}", createdBy, IssueFieldRegistry.CREATED_BY, dateField.fieldName);
                    record.put(dateField.fieldName, createdBy);
                    record.put(IssueFieldRegistry.CREATED_BY, "");
                    break;
                }
            }
        }
    }

    private String truncate(String value) {
        if (value.length() <= maxValueLength) return value;
        return value.substring(0, maxValueLength - ELLIPSIS.length()).trim() + ELLIPSIS;
    }
}
