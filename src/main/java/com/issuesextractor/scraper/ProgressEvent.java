package com.issuesextractor.scraper;

/**
 * Progress notification emitted during an extraction run.
 *
 * @param stage pipeline stage that emitted the event
 * @param iteration loop iteration or row index within the stage
 * @param rowsLoaded rows loaded (or extracted, during extraction) so far
 * @param targetEstimate expected total, 0 when unknown
 * @param message short human-readable note
 */
public record ProgressEvent(Stage stage, int iteration, int rowsLoaded, int targetEstimate, String message) {

    public enum Stage { NAVIGATION, LOADING, SCHEMA, EXTRACTION, PAGINATION, DONE }
}
