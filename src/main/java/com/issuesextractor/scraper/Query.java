package com.issuesextractor.scraper;

/**
 * One locator strategy: a kind of lookup plus its expression.
 *
 * @param kind how the expression is interpreted
 * @param expression selector, XPath, visible text, or script function source
 */
public record Query(Kind kind, String expression) {

    public enum Kind {
        /** CSS selector (structural path). */
        CSS,
        /** XPath expression, usually an attribute or text match. */
        XPATH,
        /** Visible text match. */
        TEXT,
        /** Script predicate: a function {@code (scope) => Element[]} evaluated in the document. */
        SCRIPT
    }

    public Query {
        if (kind == null) throw new IllegalArgumentException("Query kind cannot be null");
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Query expression cannot be null or blank");
        }
    }

    public static Query css(String selector) {
        return new Query(Kind.CSS, selector);
    }

    public static Query xpath(String expression) {
        return new Query(Kind.XPATH, expression);
    }

    public static Query text(String text) {
        return new Query(Kind.TEXT, text);
    }

    public static Query script(String function) {
        return new Query(Kind.SCRIPT, function);
    }

    @Override
    public String toString() {
        return kind + "[" + expression + "]";
    }
}
