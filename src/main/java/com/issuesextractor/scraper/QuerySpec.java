package com.issuesextractor.scraper;

import java.util.List;

/**
 * Ordered, immutable list of locator strategies for one logical UI target.
 * Strategies are tried in list order and the first success wins.
 *
 * @param name logical target name, used for logging
 * @param strategies strategies in priority order
 */
public record QuerySpec(String name, List<Query> strategies) {

    public QuerySpec {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("QuerySpec name cannot be blank");
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
    }

    public static QuerySpec of(String name, Query... strategies) {
        return new QuerySpec(name, List.of(strategies));
    }

    public boolean isEmpty() {
        return strategies.isEmpty();
    }
}
