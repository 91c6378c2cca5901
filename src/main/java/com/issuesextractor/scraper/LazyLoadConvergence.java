package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * Drives lazy loading and virtual scrolling until the rendered data set stops growing.
 * <p>
 * Workflow per iteration:
 * <ul>
 *   <li>Scroll the window and every nested scrollable container to the end.</li>
 *   <li>Every few iterations press paging keys, and click a "show more" control that is not inside a row.</li>
 *   <li>Let the page settle (adaptive delay), then count the rendered rows.</li>
 * </ul>
 * The loop ends SATISFIED when the target (or 95% of it) is reached, STAGNANT when the count has
 * not grown for the stagnation window even after one escalated recovery, and EXHAUSTED at the
 * iteration budget. The reported count is the best one observed, so it never decreases.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class LazyLoadConvergence {
    private static final Logger logger = LoggerFactory.getLogger(LazyLoadConvergence.class);

    private final PageHandle page;
    private final LocatorChain chain;
    private final LocatorCatalog catalog;
    private final IssueRowFinder rowFinder;
    private final ExtractorConfig config;
    private final ExtractionProgressListener listener;

    public LazyLoadConvergence(PageHandle page, LocatorChain chain, LocatorCatalog catalog, IssueRowFinder rowFinder,
                               ExtractorConfig config, ExtractionProgressListener listener) {
        this.page = page;
        this.chain = chain;
        this.catalog = catalog;
        this.rowFinder = rowFinder;
        this.config = config;
        this.listener = listener == null ? ExtractionProgressListener.none() : listener;
    }

    /**
     * Loads rows until convergence.
     * @param targetEstimate expected number of rows
     * @param maxIterations iteration budget
     * @return best row count observed and the terminal phase
     * @throws PageUnavailableException when the page dies mid-run
     */
    public LoadOutcome loadAll(int targetEstimate, int maxIterations) {
        LoadState state = new LoadState(targetEstimate, rowFinder.countRows());
        logger.info("Loading rows: {} rendered, target {}, budget {} iterations",
            state.bestCount(), state.targetEstimate(), maxIterations);

        if (state.isSatisfied()) {
            state.setPhase(LoadState.Phase.SATISFIED);
        }
        while (state.phase() != LoadState.Phase.SATISFIED && state.iteration() < maxIterations) {
            state.beginIteration();
            triggerLoad(state.iteration());
            settle(state);

            state.setPhase(LoadState.Phase.CHECKING);
            boolean grew = state.observe(rowFinder.countRows());
            listener.onProgress(new ProgressEvent(ProgressEvent.Stage.LOADING, state.iteration(),
                state.bestCount(), state.targetEstimate(), grew ? "rows grew" : "no change x" + state.noChangeStreak()));

            if (state.isSatisfied()) {
                state.setPhase(LoadState.Phase.SATISFIED);
                break;
            }
            if (!grew && state.noChangeStreak() >= config.getStagnationThreshold()) {
                if (!state.recoveryAttempted() && recover(state)) {
                    state.setPhase(state.isSatisfied() ? LoadState.Phase.SATISFIED : LoadState.Phase.CONTINUE);
                    continue;
                }
                state.setPhase(LoadState.Phase.STAGNANT);
                logger.warn("Row count stagnant at {} after {} iterations without growth", state.bestCount(), state.noChangeStreak());
                break;
            }
            state.setPhase(LoadState.Phase.CONTINUE);
        }
        if (state.phase() != LoadState.Phase.SATISFIED && state.phase() != LoadState.Phase.STAGNANT) {
            state.setPhase(LoadState.Phase.EXHAUSTED);
            logger.warn("Iteration budget of {} exhausted with {} rows loaded", maxIterations, state.bestCount());
        }
        LoadOutcome outcome = new LoadOutcome(state.bestCount(), state.phase(), state.iteration(), state.targetEstimate());
        logger.info("Load finished: {}", outcome);
        return outcome;
    }

    private void triggerLoad(int iteration) {
        safely(() -> page.evaluate(PageScripts.SCROLL_WINDOW_BOTTOM), "window scroll");
        safely(() -> page.evaluate(PageScripts.SCROLL_CONTAINERS), "container scroll");
        if (config.getPagingKeyInterval() > 0 && iteration % config.getPagingKeyInterval() == 0) {
            safely(() -> {
                page.pressKey("PageDown");
                page.pressKey("End");
            }, "paging keys");
        }
        if (config.getShowMoreInterval() > 0 && iteration % config.getShowMoreInterval() == 0) {
            boolean clicked = chain.resolveAndAct(catalog.spec(LocatorTarget.SHOW_MORE), null, notInsideRow(), page::click);
            if (clicked) logger.debug("Clicked show-more control on iteration {}", iteration);
        }
    }

    /**
     * Forces a re-render and pokes the last visible row. Runs at most once per load.
     * @return true when rows appeared afterwards
     */
    private boolean recover(LoadState state) {
        state.markRecoveryAttempted();
        logger.info("No growth for {} iterations; attempting forced re-render", state.noChangeStreak());
        safely(() -> page.evaluate(PageScripts.FORCE_RERENDER), "forced re-render");
        List<ElementHandle> rows = rowFinder.findRows();
        if (!rows.isEmpty()) {
            ElementHandle last = rows.get(rows.size() - 1);
            safely(() -> {
                page.scrollTo(last);
                page.evaluate(PageScripts.SCROLL_PARENT_CONTAINER, last);
            }, "last row scroll");
        }
        settle(state);
        int after = rowFinder.countRows();
        if (after > state.bestCount()) {
            state.observe(after);
            logger.info("Recovery loaded more rows: {}", after);
            return true;
        }
        return false;
    }

    private void settle(LoadState state) {
        long delay = config.getSettleDelayMs()
            + Math.min(state.noChangeStreak() * 100L, 1_000L)
            + Math.min(state.bestCount() * 2L, 500L);
        delay = Math.min(delay, config.getMaxSettleDelayMs());
        if (delay > 0) page.pause(delay);
    }

    private Predicate<ElementHandle> notInsideRow() {
        return candidate -> !Boolean.TRUE.equals(page.evaluate(PageScripts.INSIDE_ROW, candidate));
    }

    private static void safely(Runnable action, String description) {
        try {
            action.run();
        } catch (PageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Load trigger '{}' failed: {}", description, e.getMessage());
        }
    }
}
