package com.flagship.amortization.calendar;

/**
 * Direction in which a non-business day is moved.
 */
public enum AdjustmentDirection {
    NEXT(1),
    PREVIOUS(-1);

    private final int step;

    AdjustmentDirection(int step) {
        this.step = step;
    }

    public int step() {
        return step;
    }
}
