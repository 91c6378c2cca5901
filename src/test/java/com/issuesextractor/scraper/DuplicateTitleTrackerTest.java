package com.issuesextractor.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DuplicateTitleTrackerTest {

    private final IssueNormalizer normalizer = new IssueNormalizer(1000);

    private IssueRecord issue(String title, String priority) {
        return new IssueRecord(normalizer.normalize(Map.of(
            IssueFieldRegistry.TITLE, title, IssueFieldRegistry.PRIORITY, priority)));
    }

    @Test
    void testSameTitleDifferentContentCountsAsTitleDuplicateOnly() {
        DuplicateTitleTracker tracker = new DuplicateTitleTracker();
        tracker.track(issue("Update firewall rule", "High"));
        tracker.track(issue("Update firewall rule", "Low"));
        tracker.track(issue("Renew SSL cert", "Low"));

        DuplicateReport report = tracker.report();

        assertEquals(1, report.duplicateTitleCount());
        assertEquals(0, report.duplicateSignatureCount());
        assertEquals(Map.of("Update firewall rule", 2), report.titleOccurrences());
    }

    @Test
    void testIdenticalRowsShareSignature() {
        DuplicateTitleTracker tracker = new DuplicateTitleTracker();
        String first = tracker.track(issue("Renew SSL cert", "Low"));
        String second = tracker.track(issue("Renew SSL cert", "Low"));

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertEquals(1, tracker.report().duplicateSignatureCount());
    }

    @Test
    void testDuplicatedTitlesKeepFirstSeenOrder() {
        DuplicateTitleTracker tracker = new DuplicateTitleTracker();
        for (String title : List.of("Zero-day patch", "Backup rotation", "Zero-day patch", "Migrate DNS", "Backup rotation", "Migrate DNS")) {
            tracker.track(issue(title, "Low"));
        }

        DuplicateReport report = tracker.report();

        assertEquals(List.of("Zero-day patch", "Backup rotation", "Migrate DNS"), List.copyOf(report.titleOccurrences().keySet()));
    }

    @Test
    void testEmptyReport() {
        assertEquals(DuplicateReport.empty(), new DuplicateTitleTracker().report());
    }
}
