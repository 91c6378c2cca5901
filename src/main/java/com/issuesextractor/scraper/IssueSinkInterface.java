package com.issuesextractor.scraper;

import java.io.IOException;
import java.util.List;

/**
 * Persistence collaborator that consumes extracted issues.
 * Implementations own their identity logic; issues are keyed by Title.
 */
public interface IssueSinkInterface {

    /**
     * Inserts new issues and updates existing ones with the same Title.
     * @param issues records to store, in extraction order
     * @param target sink-specific destination (file name, table name, ...)
     * @return how many issues were inserted and updated
     * @throws IOException if the destination cannot be read or written
     */
    UpsertResult upsertIssues(List<IssueRecord> issues, String target) throws IOException;

    /**
     * Counts of one upsert.
     */
    record UpsertResult(int inserted, int updated) {}
}
