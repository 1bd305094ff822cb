package com.loh.resolution;

/**
 * What applying one order changed.
 *
 * @param units ships built, ships moved, or stars expanded, depending on the phase
 * @param pointsSpent economy points deducted from the source star
 */
record OrderOutcome(boolean applied, int units, double pointsSpent) {

    static OrderOutcome skipped() {
        return new OrderOutcome(false, 0, 0);
    }

    static OrderOutcome applied(int units, double pointsSpent) {
        return new OrderOutcome(true, units, pointsSpent);
    }
}
