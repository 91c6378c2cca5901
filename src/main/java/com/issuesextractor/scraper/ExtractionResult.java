package com.issuesextractor.scraper;

import java.util.List;

/**
 * Outcome of an extraction run: the records plus enough bookkeeping to report completeness.
 *
 * @param records extracted records in page order, duplicates included
 * @param rowsAttempted rows handed to the row extractor
 * @param rowsSkipped rows that yielded no record
 * @param duplicates duplicate statistics
 * @param schema column mapping used, null when no row was ever rendered
 * @param loads convergence outcome of every page visited
 * @param status overall completeness
 */
public record ExtractionResult(List<IssueRecord> records, int rowsAttempted, int rowsSkipped,
                               DuplicateReport duplicates, SchemaMap schema, List<LoadOutcome> loads, Status status) {

    public enum Status {
        /** Every page converged. */
        COMPLETE,
        /** Records were returned but at least one load stagnated or ran out of iterations. */
        PARTIAL,
        /** No records; distinct from a failure, which is thrown. */
        EMPTY
    }

    public ExtractionResult {
        records = List.copyOf(records);
        loads = List.copyOf(loads);
    }

    public int rowsExtracted() {
        return records.size();
    }

    public int pagesVisited() {
        return loads.size();
    }
}
