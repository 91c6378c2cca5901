package com.issuesextractor.scraper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultCatalogCoversEveryTarget() {
        LocatorCatalog catalog = LocatorCatalog.loadDefault();

        for (LocatorTarget target : LocatorTarget.values()) {
            assertFalse(catalog.spec(target).isEmpty(), "no strategies for " + target);
        }
        assertEquals(Query.css(":scope > td"), catalog.spec(LocatorTarget.ROW_CELLS).strategies().get(0));
        assertEquals(Query.Kind.SCRIPT, lastOf(catalog.spec(LocatorTarget.ISSUE_ROWS)).kind());
    }

    @Test
    void testMissingTargetYieldsEmptySpec() {
        LocatorCatalog catalog = LocatorCatalog.of(Map.of(LocatorTarget.NEXT_PAGE, List.of(Query.css("next"))));

        assertTrue(catalog.spec(LocatorTarget.SHOW_MORE).isEmpty());
        assertEquals("SHOW_MORE", catalog.spec(LocatorTarget.SHOW_MORE).name());
        assertEquals(1, catalog.spec(LocatorTarget.NEXT_PAGE).strategies().size());
    }

    @Test
    void testOverrideFileReplacesOnlyListedTargets() throws Exception {
        Path file = tempDir.resolve("locators.json");
        Files.writeString(file, "{\"NEXT_PAGE\": [{\"kind\": \"TEXT\", \"expression\": \"Siguiente\"}]}");

        LocatorCatalog catalog = LocatorCatalog.load(file);

        assertEquals(List.of(Query.text("Siguiente")), catalog.spec(LocatorTarget.NEXT_PAGE).strategies());
        assertEquals(LocatorCatalog.loadDefault().spec(LocatorTarget.ISSUE_ROWS), catalog.spec(LocatorTarget.ISSUE_ROWS));
    }

    @Test
    void testMissingOverrideFileKeepsDefaults() {
        LocatorCatalog catalog = LocatorCatalog.load(tempDir.resolve("absent.json"));
        assertFalse(catalog.spec(LocatorTarget.ISSUES_TAB).isEmpty());
    }

    @Test
    void testBlankExpressionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Query.css(" "));
    }

    private static Query lastOf(QuerySpec spec) {
        return spec.strategies().get(spec.strategies().size() - 1);
    }
}
