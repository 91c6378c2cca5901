package com.issuesextractor.scraper;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Value vocabularies and patterns shared by schema inference, row extraction and normalization.
 */
public final class ValuePatterns {
    private ValuePatterns() {}

    public static final List<String> STATUSES = List.of(
        "OPEN", "IN PROGRESS", "DONE", "READY FOR PUBLISHING", "READY", "ACCEPTED", "DRAFT", "CLOSED");

    public static final List<String> PRIORITIES = List.of("Very High", "High", "Medium", "Low");

    private static final String MONTH = "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
        + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?|ene(?:ro)?|abr(?:il)?|ago(?:sto)?|dic(?:iembre)?)\\.?";

    private static final Pattern DATE = Pattern.compile(
        "(?i)(\\b" + MONTH + "\\s+\\d{1,2}\\b)"
            + "|(\\b\\d{1,2}\\.?\\s+" + MONTH + "(?:\\s|,|$))"
            + "|(\\b\\d{4}-\\d{2}-\\d{2}\\b)"
            + "|(\\b\\d{1,2}[./]\\d{1,2}[./]\\d{2,4}\\b)");

    private static final Pattern USER_ID = Pattern.compile("^[A-Z]\\d{4,9}$");

    private static final Pattern VERY_HIGH = Pattern.compile("(?i)\\b(very high|muy alta|critical)\\b");
    private static final Pattern HIGH = Pattern.compile("(?i)\\b(high|alta)\\b");
    private static final Pattern MEDIUM = Pattern.compile("(?i)\\b(medium|media)\\b");
    private static final Pattern LOW = Pattern.compile("(?i)\\b(low|baja)\\b");

    /**
     * @return true when the text contains a month-name, ISO or numeric date
     */
    public static boolean looksLikeDate(String text) {
        return text != null && !text.isBlank() && DATE.matcher(text).find();
    }

    /**
     * @return true for internal user ids such as {@code I587465}
     */
    public static boolean looksLikeUserId(String text) {
        return text != null && USER_ID.matcher(text.trim()).matches();
    }

    /**
     * Maps free text onto the status vocabulary by keyword containment.
     * @return canonical status, or null when no keyword is present
     */
    public static String canonicalStatus(String text) {
        if (text == null || text.isBlank()) return null;
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("IN PROGRESS")) return "IN PROGRESS";
        if (upper.contains("OPEN")) return "OPEN";
        if (upper.contains("DONE")) return "DONE";
        if (upper.contains("READY")) return upper.contains("PUBLISH") ? "READY FOR PUBLISHING" : "READY";
        if (upper.contains("ACCEPTED")) return "ACCEPTED";
        if (upper.contains("DRAFT")) return "DRAFT";
        if (upper.contains("CLOSED")) return "CLOSED";
        return null;
    }

    /**
     * Maps free text onto the priority vocabulary by whole-word match.
     * @return canonical priority, or null when no priority word is present
     */
    public static String canonicalPriority(String text) {
        if (text == null || text.isBlank()) return null;
        if (VERY_HIGH.matcher(text).find()) return "Very High";
        if (HIGH.matcher(text).find()) return "High";
        if (MEDIUM.matcher(text).find()) return "Medium";
        if (LOW.matcher(text).find()) return "Low";
        return null;
    }

    /**
     * @return the canonical status when the whole line is a status label, otherwise null
     */
    public static String exactStatus(String line) {
        if (line == null) return null;
        String upper = Utils.collapseWhitespace(line).toUpperCase(Locale.ROOT);
        return STATUSES.contains(upper) ? upper : null;
    }

    /**
     * @return the canonical priority when the whole line is a priority label, otherwise null
     */
    public static String exactPriority(String line) {
        if (line == null) return null;
        String trimmed = Utils.collapseWhitespace(line);
        for (String p : PRIORITIES) if (p.equalsIgnoreCase(trimmed)) return p;
        return null;
    }
}
