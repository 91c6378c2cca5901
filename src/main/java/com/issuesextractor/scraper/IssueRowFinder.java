package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the currently rendered data rows. Header rows and rows without text are left out.
 * Handles are re-queried on every call and must not be kept across iterations.
 */
public class IssueRowFinder {
    private static final Logger logger = LoggerFactory.getLogger(IssueRowFinder.class);

    private final LocatorChain chain;
    private final QuerySpec rowSpec;

    public IssueRowFinder(LocatorChain chain, LocatorCatalog catalog) {
        this.chain = chain;
        this.rowSpec = catalog.spec(LocatorTarget.ISSUE_ROWS);
    }

    public List<ElementHandle> findRows() {
        List<ElementHandle> rows = new ArrayList<>();
        for (ElementHandle candidate : chain.resolveAll(rowSpec, null)) {
            try {
                if (isDataRow(candidate)) rows.add(candidate);
            } catch (StaleHandleException e) {
                logger.trace("Row went stale while filtering: {}", e.getMessage());
            }
        }
        return rows;
    }

    public int countRows() {
        return findRows().size();
    }

    private static boolean isDataRow(ElementHandle row) {
        String cls = row.attribute("class");
        if (cls != null && cls.toLowerCase(Locale.ROOT).contains("header")) return false;
        String text = row.text();
        return text != null && !text.isBlank();
    }
}
