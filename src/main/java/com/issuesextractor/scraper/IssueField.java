package com.issuesextractor.scraper;

import java.util.List;

/**
 * Represents one output field of an issue record.
 * Contains the field name, the header strings aliased onto it and the kind of value it holds.
 */
public class IssueField {

    /** Kind of value a field holds; drives content-based inference and normalization. */
    public enum Kind { TEXT, DATE, STATUS, PRIORITY, USER }

    public final String fieldName;
    public final List<String> synonyms;
    public final Kind kind;
    public final boolean canonical;

    public IssueField(String fieldName, List<String> synonyms, Kind kind, boolean canonical) {
        this.fieldName = fieldName;
        this.synonyms = List.copyOf(synonyms);
        this.kind = kind;
        this.canonical = canonical;
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
