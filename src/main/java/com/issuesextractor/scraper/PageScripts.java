package com.issuesextractor.scraper;

/**
 * Script functions evaluated in the page through {@link PageHandle#evaluate}.
 */
public final class PageScripts {
    private PageScripts() {}

    /** Full text content of an element, including text hidden from innerText. */
    public static final String TEXT_CONTENT = "el => (el.textContent || '').trim()";

    /** Whether an element sits inside a data row (row-level expanders are not data-set loaders). */
    public static final String INSIDE_ROW =
        "el => !!el.closest('tr, [role=row], li.sapMLIB, .sapMLIB, .sapMListTblRow')";

    public static final String SCROLL_WINDOW_BOTTOM =
        "() => { window.scrollTo(0, document.body.scrollHeight); return document.body.scrollHeight; }";

    /** Scrolls every scrollable container to its end; returns how many were scrolled. */
    public static final String SCROLL_CONTAINERS =
        "() => { let n = 0; document.querySelectorAll('*').forEach(el => {"
            + " const s = getComputedStyle(el);"
            + " if ((s.overflowY === 'auto' || s.overflowY === 'scroll') && el.scrollHeight > el.clientHeight) {"
            + " el.scrollTop = el.scrollHeight; n++; } }); return n; }";

    /** Forces the host framework to re-measure its virtualized viewport. */
    public static final String FORCE_RERENDER =
        "() => { window.dispatchEvent(new Event('resize')); window.scrollBy(0, -50); window.scrollBy(0, 50); return true; }";

    /** Scrolls the nearest scrollable ancestor of an element to its end. */
    public static final String SCROLL_PARENT_CONTAINER =
        "el => { let p = el.parentElement; while (p && p.scrollHeight <= p.clientHeight) p = p.parentElement;"
            + " if (p) { p.scrollTop = p.scrollHeight; return true; } return false; }";
}
