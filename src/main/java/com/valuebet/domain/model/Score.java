package com.valuebet.domain.model;

/**
 * Correct-score prediction, home goals first.
 */
public record Score(int home, int away) {

    public Score swapped() {
        return new Score(away, home);
    }

    /** Runner name used by the exchange for this score, e.g. "2 - 1". */
    public String runnerName() {
        return home + " - " + away;
    }

    @Override
    public String toString() {
        return home + "-" + away;
    }
}
