package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Finds UI elements despite attribute drift by walking a {@link QuerySpec}'s strategies in order.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Evaluates each strategy against the live tree, within an optional scope element.</li>
 *   <li>Keeps only candidates that are visible and, for single targets, enabled.</li>
 *   <li>Script-predicate candidates that are hidden get scrolled into view once and re-checked.</li>
 *   <li>Candidates that go stale mid-check are skipped; an exhausted chain yields an empty result.</li>
 * </ul>
 * Only {@link PageUnavailableException} escapes: it means the page is gone.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class LocatorChain {
    private static final Logger logger = LoggerFactory.getLogger(LocatorChain.class);

    private final PageHandle page;
    private final int staleRetryCount;
    private final long staleRetryBackoffMs;

    public LocatorChain(PageHandle page, int staleRetryCount, long staleRetryBackoffMs) {
        if (page == null) throw new IllegalArgumentException("PageHandle cannot be null");
        this.page = page;
        this.staleRetryCount = Math.max(1, staleRetryCount);
        this.staleRetryBackoffMs = Math.max(0, staleRetryBackoffMs);
    }

    public LocatorChain(PageHandle page, ExtractorConfig config) {
        this(page, config.getStaleRetryCount(), config.getStaleRetryBackoffMs());
    }

    /**
     * Returns the first visible and interactable element matched by the spec.
     * @param spec strategies for the target
     * @param scope element to search within, or null for the whole page
     * @return the element, or empty when every strategy is exhausted
     */
    public Optional<ElementHandle> resolve(QuerySpec spec, ElementHandle scope) {
        return resolve(spec, scope, candidate -> true);
    }

    /**
     * Same as {@link #resolve(QuerySpec, ElementHandle)} with an extra candidate filter.
     */
    public Optional<ElementHandle> resolve(QuerySpec spec, ElementHandle scope, Predicate<ElementHandle> filter) {
        for (Query query : spec.strategies()) {
            List<ElementHandle> candidates = runQuery(spec, query, scope);
            for (ElementHandle candidate : candidates) {
                if (isUsable(candidate, query, true) && accepts(filter, candidate)) {
                    logger.debug("Resolved {} via {}", spec.name(), query);
                    return Optional.of(candidate);
                }
            }
        }
        logger.debug("No strategy resolved {} ({} strategies tried)", spec.name(), spec.strategies().size());
        return Optional.empty();
    }

    /**
     * Returns the visible candidates of the first strategy that yields any.
     * Used for collections (rows, cells) where enabled state does not apply.
     */
    public List<ElementHandle> resolveAll(QuerySpec spec, ElementHandle scope) {
        for (Query query : spec.strategies()) {
            List<ElementHandle> visible = new ArrayList<>();
            for (ElementHandle candidate : runQuery(spec, query, scope)) {
                if (isUsable(candidate, query, false)) visible.add(candidate);
            }
            if (!visible.isEmpty()) {
                logger.debug("Resolved {} x{} via {}", spec.name(), visible.size(), query);
                return visible;
            }
        }
        return List.of();
    }

    /**
     * Resolves the target and applies an action to it. When the handle goes stale between
     * resolution and action the target is resolved again, up to the configured retry count,
     * with exponential backoff between attempts.
     * @param spec strategies for the target
     * @param scope element to search within, or null for the whole page
     * @param action action applied to the resolved handle
     * @return true when the action completed, false when the target was absent or kept going stale
     */
    public boolean resolveAndAct(QuerySpec spec, ElementHandle scope, Consumer<ElementHandle> action) {
        return resolveAndAct(spec, scope, candidate -> true, action);
    }

    public boolean resolveAndAct(QuerySpec spec, ElementHandle scope, Predicate<ElementHandle> filter,
                                 Consumer<ElementHandle> action) {
        Boolean done = Utils.retry(() -> {
            Optional<ElementHandle> target = resolve(spec, scope, filter);
            if (target.isEmpty()) return Boolean.FALSE;
            action.accept(target.get());
            return Boolean.TRUE;
        }, staleRetryCount, staleRetryBackoffMs, "action on " + spec.name());
        return Boolean.TRUE.equals(done);
    }

    /**
     * Clicks the target through {@link #resolveAndAct}.
     */
    public boolean click(QuerySpec spec, ElementHandle scope) {
        return resolveAndAct(spec, scope, page::click);
    }

    /**
     * Runs one strategy without visibility filtering. Failures other than a dead page are logged
     * and treated as no match.
     */
    List<ElementHandle> runQuery(QuerySpec spec, Query query, ElementHandle scope) {
        try {
            List<ElementHandle> found = page.query(query, scope);
            return found == null ? List.of() : found;
        } catch (StaleHandleException e) {
            logger.debug("Scope went stale while querying {} via {}: {}", spec.name(), query, e.getMessage());
        } catch (PageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Strategy {} failed for {}: {}", query, spec.name(), e.getMessage());
        }
        return List.of();
    }

    PageHandle page() {
        return page;
    }

    private boolean isUsable(ElementHandle candidate, Query query, boolean requireEnabled) {
        try {
            boolean visible = candidate.isVisible();
            if (!visible && query.kind() == Query.Kind.SCRIPT) {
                page.scrollTo(candidate);
                visible = candidate.isVisible();
            }
            return visible && (!requireEnabled || candidate.isEnabled());
        } catch (StaleHandleException e) {
            logger.debug("Candidate from {} went stale: {}", query, e.getMessage());
            return false;
        }
    }

    private static boolean accepts(Predicate<ElementHandle> filter, ElementHandle candidate) {
        try {
            return filter.test(candidate);
        } catch (StaleHandleException e) {
            logger.debug("Candidate went stale in filter: {}", e.getMessage());
            return false;
        }
    }
}
