package com.issuesextractor.scraper;

/**
 * Logical UI targets the engine looks up through the {@link LocatorCatalog}.
 */
public enum LocatorTarget {
    ISSUES_TAB,
    SETTINGS_BUTTON,
    COLUMNS_TAB,
    SELECT_ALL_COLUMNS,
    CONFIRM_COLUMNS,
    ISSUE_ROWS,
    HEADER_ROW,
    HEADER_CELLS,
    ROW_CELLS,
    CELL_TEXT_DESCENDANT,
    ROW_TITLE,
    SHOW_MORE,
    NEXT_PAGE,
    COUNT_BADGE,
    COUNT_CAPTION,
    PRIORITY_VERY_HIGH,
    PRIORITY_HIGH,
    PRIORITY_MEDIUM,
    PRIORITY_LOW
}
