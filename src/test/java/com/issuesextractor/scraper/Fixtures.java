package com.issuesextractor.scraper;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for engine tests: a label-based locator catalog, rows and a config with no delays.
 */
final class Fixtures {
    private Fixtures() {}

    static Map<LocatorTarget, List<Query>> table() {
        Map<LocatorTarget, List<Query>> table = new EnumMap<>(LocatorTarget.class);
        table.put(LocatorTarget.ISSUES_TAB, List.of(Query.xpath("issues-tab"), Query.text("Issues")));
        table.put(LocatorTarget.SETTINGS_BUTTON, List.of(Query.css("settings")));
        table.put(LocatorTarget.COLUMNS_TAB, List.of(Query.text("Columns")));
        table.put(LocatorTarget.SELECT_ALL_COLUMNS, List.of(Query.css("select-all")));
        table.put(LocatorTarget.CONFIRM_COLUMNS, List.of(Query.xpath("ok")));
        table.put(LocatorTarget.ISSUE_ROWS, List.of(Query.css("row")));
        table.put(LocatorTarget.HEADER_ROW, List.of(Query.css("header-row")));
        table.put(LocatorTarget.HEADER_CELLS, List.of(Query.css("th")));
        table.put(LocatorTarget.ROW_CELLS, List.of(Query.css("td"), Query.css("gridcell")));
        table.put(LocatorTarget.CELL_TEXT_DESCENDANT, List.of(Query.css("inner")));
        table.put(LocatorTarget.ROW_TITLE, List.of(Query.css("title-link")));
        table.put(LocatorTarget.SHOW_MORE, List.of(Query.css("show-more")));
        table.put(LocatorTarget.NEXT_PAGE, List.of(Query.css("next")));
        table.put(LocatorTarget.COUNT_BADGE, List.of(Query.css("badge")));
        table.put(LocatorTarget.COUNT_CAPTION, List.of(Query.css("caption")));
        table.put(LocatorTarget.PRIORITY_VERY_HIGH, List.of(Query.css("prio-very-high")));
        table.put(LocatorTarget.PRIORITY_HIGH, List.of(Query.css("prio-high")));
        table.put(LocatorTarget.PRIORITY_MEDIUM, List.of(Query.css("prio-medium")));
        table.put(LocatorTarget.PRIORITY_LOW, List.of(Query.css("prio-low")));
        return table;
    }

    static LocatorCatalog catalog() {
        return LocatorCatalog.of(table());
    }

    /**
     * A data row with one {@code td} cell per value.
     */
    static FakeElement row(String... cells) {
        FakeElement row = FakeElement.container("row");
        for (String cell : cells) row.add(FakeElement.of(cell, "td"));
        return row;
    }

    static FakeElement headerRow(String... headers) {
        FakeElement header = FakeElement.container("header-row");
        for (String h : headers) header.add(FakeElement.of(h, "th"));
        return header;
    }

    /**
     * Rows named "Issue 1".."Issue n" with a type column, so the table parses positionally.
     */
    static FakeElement[] numberedRows(int from, int to) {
        FakeElement[] rows = new FakeElement[to - from + 1];
        for (int i = from; i <= to; i++) rows[i - from] = row("Issue " + i, "Task");
        return rows;
    }

    static ExtractorConfig fastConfig() {
        ExtractorConfig config = new ExtractorConfig();
        config.setSettleDelayMs(0);
        config.setMaxSettleDelayMs(0);
        config.setStaleRetryBackoffMs(0);
        config.setSelectAllColumns(false);
        return config;
    }

    static LocatorChain chain(FakePage page) {
        return new LocatorChain(page, 3, 0);
    }
}
