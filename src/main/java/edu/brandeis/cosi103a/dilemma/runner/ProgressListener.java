package edu.brandeis.cosi103a.dilemma.runner;

/**
 * Receives a callback after each pair-run of a tournament completes.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total, pair) -> { };

    /**
     * @param completed pair-runs finished so far, including this one
     * @param total     pair-runs in the whole tournament
     * @param pair      the pair that just finished
     */
    void pairCompleted(int completed, int total, PairResult pair);
}
