package com.flagship.amortization.schedule;

import com.flagship.amortization.calendar.AdjustmentDirection;

import java.util.Optional;

/**
 * How generated due dates are moved when they fall on a weekend or holiday.
 */
public enum DueDateAdjustment {
    /**
     * Keep the generated date even when it is not a business day.
     */
    NONE,

    /**
     * Move forward to the next business day.
     */
    NEXT_BUSINESS_DAY,

    /**
     * Move back to the previous business day.
     */
    PREVIOUS_BUSINESS_DAY;

    public Optional<AdjustmentDirection> direction() {
        return switch (this) {
            case NONE -> Optional.empty();
            case NEXT_BUSINESS_DAY -> Optional.of(AdjustmentDirection.NEXT);
            case PREVIOUS_BUSINESS_DAY -> Optional.of(AdjustmentDirection.PREVIOUS);
        };
    }
}
