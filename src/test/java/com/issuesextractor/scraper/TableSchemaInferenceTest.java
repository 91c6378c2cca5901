package com.issuesextractor.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TableSchemaInferenceTest {

    private static final List<String> CANONICAL_HEADERS = List.of(
        "Title", "Type", "Priority", "Status", "Deadline", "Due Date", "Created By", "Created On");

    @Test
    void testCanonicalHeadersMapInOrder() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(CANONICAL_HEADERS, List.of());

        for (int i = 0; i < CANONICAL_HEADERS.size(); i++) {
            assertEquals(i, schema.indexOf(CANONICAL_HEADERS.get(i)));
        }
        assertEquals(SchemaMap.Source.HEADER, schema.source());
        assertTrue(schema.unmatchedHeaders().isEmpty());
    }

    @Test
    void testSynonymsAndDecoratedHeaders() {
        List<String> headers = List.of("Issue Title", "Status:", "Assignee", "Prio", "Created On*", "Sprint Goal");

        SchemaMap schema = TableSchemaInference.inferFromTexts(headers, List.of());

        assertEquals(0, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(1, schema.indexOf(IssueFieldRegistry.STATUS));
        assertEquals(2, schema.indexOf("Assigned To"));
        assertEquals(3, schema.indexOf(IssueFieldRegistry.PRIORITY));
        assertEquals(4, schema.indexOf(IssueFieldRegistry.CREATED_ON));
        assertEquals(SchemaMap.UNMAPPED, schema.indexOf(IssueFieldRegistry.DEADLINE));
        assertEquals(List.of("Sprint Goal"), schema.unmatchedHeaders());
    }

    @Test
    void testLongestSynonymWinsForCompositeHeaders() {
        assertEquals(IssueFieldRegistry.DUE_DATE, TableSchemaInference.partialHeaderMatch("DUE DATE (UTC)", Set.of()));
        assertEquals(IssueFieldRegistry.CREATED_BY, TableSchemaInference.partialHeaderMatch("ISSUE CREATED BY", Set.of()));
        assertNull(TableSchemaInference.partialHeaderMatch("SPRINT GOAL", Set.of()));
    }

    @Test
    void testExactSynonymBeatsEarlierWordMatch() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(
            List.of("Issue Key", "Summary", "Type", "Priority", "Status"),
            List.of("ABC-1", "Fix login bug", "Incident", "High", "OPEN"));

        assertEquals(1, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(0, schema.indexOf("Issue ID"));
        assertEquals(4, schema.indexOf(IssueFieldRegistry.STATUS));
        assertTrue(schema.unmatchedHeaders().isEmpty());
        assertEquals(SchemaMap.Source.HEADER, schema.source());
    }

    @Test
    void testCanonicalFieldsTakePositionalDefaults() {
        List<String> sample = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i");

        SchemaMap schema = TableSchemaInference.inferFromTexts(null, sample);

        List<IssueField> canonical = IssueFieldRegistry.canonicalFields();
        assertEquals(8, canonical.size());
        for (int i = 0; i < canonical.size(); i++) {
            assertTrue(canonical.get(i).canonical);
            assertEquals(i, schema.indexOf(canonical.get(i).fieldName));
        }
        assertEquals(SchemaMap.UNMAPPED, schema.indexOf("Issue ID"));
    }

    @Test
    void testEachFieldMapsToOneColumnOnly() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(
            List.of("Title", "Name", "Type", "Priority", "Status"), List.of());

        assertEquals(0, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(List.of("Name"), schema.unmatchedHeaders());
    }

    @Test
    void testNoHeaderUsesPositionalDefaultsThenContent() {
        List<String> sample = List.of("Renew SSL cert", "Task", "High", "OPEN", "Mar 3, 2024", "Mar 10, 2024",
            "I587465", "Feb 1, 2024", "Apr 2, 2024", "D012345");

        SchemaMap schema = TableSchemaInference.inferFromTexts(null, sample);

        assertEquals(0, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(7, schema.indexOf(IssueFieldRegistry.CREATED_ON));
        assertEquals(8, schema.indexOf("Last Changed On"));
        assertEquals(9, schema.indexOf("Assigned To"));
        assertEquals(SchemaMap.Source.CONTENT, schema.source());
    }

    @Test
    void testShortSampleOnlyMapsAvailableColumns() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(null, List.of("Renew SSL cert", "Task", "High"));

        assertEquals(2, schema.indexOf(IssueFieldRegistry.PRIORITY));
        assertFalse(schema.isMapped(IssueFieldRegistry.STATUS));
        assertEquals(SchemaMap.Source.POSITIONAL, schema.source());
    }

    @Test
    void testTooFewHeaderMatchesFallsBackToPositions() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(List.of("Name", "Foo", "Bar"), List.of("Fix login", "Bug", "Low"));

        assertEquals(0, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(1, schema.indexOf(IssueFieldRegistry.TYPE));
        assertEquals(2, schema.indexOf(IssueFieldRegistry.PRIORITY));
        assertEquals(SchemaMap.Source.POSITIONAL, schema.source());
    }

    @Test
    void testTitleFallsBackToFirstUnusedNonEmptyColumn() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(
            List.of("Type", "Priority", "Status", "Created On", "Whatever"),
            List.of("Bug", "High", "OPEN", "Jan 1, 2024", "Renew cert"));

        assertEquals(4, schema.indexOf(IssueFieldRegistry.TITLE));
        assertEquals(SchemaMap.Source.HEADER, schema.source());
    }

    @Test
    void testTitleIsAlwaysMapped() {
        SchemaMap schema = TableSchemaInference.inferFromTexts(null, List.of());
        assertEquals(0, schema.indexOf(IssueFieldRegistry.TITLE));
    }

    @Test
    void testInferFromLiveHeaderAndRows() {
        FakeElement header = Fixtures.headerRow("Title", "Type", "Priority", "Status", "Due Date");
        FakeElement row = Fixtures.row("Renew SSL cert", "Task", "High", "Open", "2024-05-01");
        FakePage page = new FakePage().add(header, row);
        LocatorCatalog catalog = Fixtures.catalog();
        LocatorChain chain = Fixtures.chain(page);
        TableSchemaInference inference = new TableSchemaInference(chain, catalog, new RowCellResolver(chain, catalog));

        ElementHandle found = inference.findHeaderRow().orElseThrow();
        SchemaMap schema = inference.infer(found, List.of(row));

        assertSame(header, found);
        assertEquals(4, schema.indexOf(IssueFieldRegistry.DUE_DATE));
        assertEquals(SchemaMap.Source.HEADER, schema.source());
    }

    @Test
    void testStaleHeaderFallsBackToSampleRow() {
        FakeElement header = Fixtures.headerRow("Title", "Type", "Priority", "Status");
        FakeElement row = Fixtures.row("Renew SSL cert", "Task", "High", "OPEN", "Mar 3, 2024");
        FakePage page = new FakePage().add(header, row);
        LocatorCatalog catalog = Fixtures.catalog();
        LocatorChain chain = Fixtures.chain(page);
        TableSchemaInference inference = new TableSchemaInference(chain, catalog, new RowCellResolver(chain, catalog));
        header.detached = true;

        SchemaMap schema = inference.infer(header, List.of(row));

        assertEquals(SchemaMap.Source.POSITIONAL, schema.source());
        assertEquals(4, schema.indexOf(IssueFieldRegistry.DEADLINE));
    }
}
