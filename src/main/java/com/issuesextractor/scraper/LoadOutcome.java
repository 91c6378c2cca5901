package com.issuesextractor.scraper;

/**
 * Result of one convergence run.
 *
 * @param finalRowCount best row count observed
 * @param phase terminal phase: SATISFIED, STAGNANT or EXHAUSTED
 * @param iterations load iterations performed
 * @param targetEstimate target the run aimed for
 */
public record LoadOutcome(int finalRowCount, LoadState.Phase phase, int iterations, int targetEstimate) {

    /**
     * @return true when the target (or the early-exit share of it) was reached
     */
    public boolean isComplete() {
        return phase == LoadState.Phase.SATISFIED;
    }
}
