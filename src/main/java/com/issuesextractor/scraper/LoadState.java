package com.issuesextractor.scraper;

/**
 * Transient counters of one convergence run. Created fresh for every run and never shared.
 */
public class LoadState {

    public enum Phase { SCROLLING, CHECKING, CONTINUE, STAGNANT, SATISFIED, EXHAUSTED }

    private static final double EARLY_EXIT_RATIO = 0.95;

    private final int targetEstimate;
    private int previousCount;
    private int bestCount;
    private int noChangeStreak;
    private int iteration;
    private boolean recoveryAttempted;
    private Phase phase = Phase.CHECKING;

    public LoadState(int targetEstimate, int initialCount) {
        this.targetEstimate = Math.max(1, targetEstimate);
        this.previousCount = initialCount;
        this.bestCount = initialCount;
    }

    void beginIteration() {
        iteration++;
        phase = Phase.SCROLLING;
    }

    /**
     * Records a row count.
     * @return true when the count exceeded the best seen so far
     */
    boolean observe(int count) {
        previousCount = count;
        if (count > bestCount) {
            bestCount = count;
            noChangeStreak = 0;
            return true;
        }
        noChangeStreak++;
        return false;
    }

    boolean isSatisfied() {
        int earlyExit = (int) Math.ceil(targetEstimate * EARLY_EXIT_RATIO);
        return bestCount >= targetEstimate || bestCount >= earlyExit;
    }

    void markRecoveryAttempted() {
        recoveryAttempted = true;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    public int targetEstimate() { return targetEstimate; }
    public int previousCount() { return previousCount; }
    public int bestCount() { return bestCount; }
    public int noChangeStreak() { return noChangeStreak; }
    public int iteration() { return iteration; }
    public boolean recoveryAttempted() { return recoveryAttempted; }
    public Phase phase() { return phase; }
}
