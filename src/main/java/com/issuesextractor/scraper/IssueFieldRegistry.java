package com.issuesextractor.scraper;

import java.util.*;

/**
 * Central registry for all issue fields and their header synonyms.
 * The first eight entries are the canonical fields in their default column order; the rest are
 * optional fields that only fill when a header or cell content identifies them.
 * Add a synonym here and every consumer (schema inference, export) picks it up.
 */
public final class IssueFieldRegistry {
    private IssueFieldRegistry() {}

    public static final String TITLE = "Title";
    public static final String TYPE = "Type";
    public static final String PRIORITY = "Priority";
    public static final String STATUS = "Status";
    public static final String DEADLINE = "Deadline";
    public static final String DUE_DATE = "Due Date";
    public static final String CREATED_BY = "Created By";
    public static final String CREATED_ON = "Created On";

    private static final List<IssueField> FIELDS = List.of(
        new IssueField(TITLE, List.of("TITLE", "ISSUE TITLE", "NAME", "ISSUE", "SUBJECT", "SUMMARY", "SHORT TEXT", "TÍTULO", "TITEL"), IssueField.Kind.TEXT, true),
        new IssueField(TYPE, List.of("TYPE", "ISSUE TYPE", "KIND", "TIPO", "TYP"), IssueField.Kind.TEXT, true),
        new IssueField(PRIORITY, List.of("PRIORITY", "PRIO", "PRIORIDAD", "PRIORITÄT", "URGENCY"), IssueField.Kind.PRIORITY, true),
        new IssueField(STATUS, List.of("STATUS", "STATE", "ESTADO", "LIFECYCLE STATUS"), IssueField.Kind.STATUS, true),
        new IssueField(DEADLINE, List.of("DEADLINE", "TARGET DATE", "FECHA LÍMITE"), IssueField.Kind.DATE, true),
        new IssueField(DUE_DATE, List.of("DUE DATE", "DUE", "DUE ON", "FECHA DE VENCIMIENTO"), IssueField.Kind.DATE, true),
        new IssueField(CREATED_BY, List.of("CREATED BY", "CREATOR", "REPORTED BY", "AUTHOR", "CREADO POR"), IssueField.Kind.USER, true),
        new IssueField(CREATED_ON, List.of("CREATED ON", "CREATED", "CREATION DATE", "CREATED AT", "CREADO EL"), IssueField.Kind.DATE, true),
        new IssueField("Issue ID", List.of("ID", "ISSUE ID", "NUMBER", "NO.", "KEY"), IssueField.Kind.TEXT, false),
        new IssueField("Assigned To", List.of("ASSIGNED TO", "ASSIGNEE", "PROCESSOR", "RESPONSIBLE", "OWNER", "ASIGNADO A"), IssueField.Kind.USER, false),
        new IssueField("Component", List.of("COMPONENT", "MODULE", "AREA"), IssueField.Kind.TEXT, false),
        new IssueField("Category", List.of("CATEGORY", "CATEGORÍA", "CLASSIFICATION"), IssueField.Kind.TEXT, false),
        new IssueField("Last Changed On", List.of("LAST CHANGED ON", "CHANGED ON", "LAST UPDATED", "MODIFIED ON", "UPDATED ON"), IssueField.Kind.DATE, false),
        new IssueField("Last Changed By", List.of("LAST CHANGED BY", "CHANGED BY", "MODIFIED BY", "UPDATED BY"), IssueField.Kind.USER, false),
        new IssueField("Completed On", List.of("COMPLETED ON", "CLOSED ON", "RESOLVED ON", "COMPLETION DATE"), IssueField.Kind.DATE, false),
        new IssueField("Project", List.of("PROJECT", "PROYECTO"), IssueField.Kind.TEXT, false),
        new IssueField("Customer", List.of("CUSTOMER", "CLIENT", "CLIENTE"), IssueField.Kind.TEXT, false),
        new IssueField("Description", List.of("DESCRIPTION", "DETAILS", "DESCRIPCIÓN"), IssueField.Kind.TEXT, false)
    );

    private static final List<String> FIELD_NAMES;
    private static final List<IssueField> CANONICAL_FIELDS;
    static {
        List<String> names = new ArrayList<>();
        List<IssueField> canonical = new ArrayList<>();
        for (IssueField f : FIELDS) {
            names.add(f.fieldName);
            if (f.canonical) canonical.add(f);
        }
        FIELD_NAMES = Collections.unmodifiableList(names);
        CANONICAL_FIELDS = Collections.unmodifiableList(canonical);
    }

    /**
     * Returns the list of all issue fields in output order.
     */
    public static List<IssueField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the list of all field names in output order.
     */
    public static List<String> getFieldNames() {
        return FIELD_NAMES;
    }

    /**
     * Returns the canonical fields in their default column order.
     */
    public static List<IssueField> canonicalFields() {
        return CANONICAL_FIELDS;
    }

    /**
     * Returns the fields of one kind in registry order.
     */
    public static List<IssueField> fieldsOfKind(IssueField.Kind kind) {
        List<IssueField> out = new ArrayList<>();
        for (IssueField f : FIELDS) if (f.kind == kind) out.add(f);
        return out;
    }
}
