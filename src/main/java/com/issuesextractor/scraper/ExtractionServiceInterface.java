package com.issuesextractor.scraper;

/**
 * Interface for issue extraction runs against one live page.
 */
public interface ExtractionServiceInterface {
    /**
     * Runs the full pipeline: navigation, load convergence, schema inference, row extraction,
     * pagination and duplicate statistics.
     * @return every extracted record plus completeness bookkeeping; never null
     * @throws PageUnavailableException when the page is lost mid-run
     */
    ExtractionResult run();

    /**
     * Opens the issues view and, when configured, makes every column visible.
     * Missing controls are not an error: the view may already be open.
     */
    void openIssuesView();
}
