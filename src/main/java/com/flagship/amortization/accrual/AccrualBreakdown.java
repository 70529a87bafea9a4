package com.flagship.amortization.accrual;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Penalty, interest and discount owed on an installment at a given date,
 * already rounded to the minor unit.
 */
@Value
@Builder
public class AccrualBreakdown {
    BigDecimal penalty;
    BigDecimal interest;
    BigDecimal discount;
    long daysLate;
    long daysEarly;
    long billableDays;
    boolean withinTolerance;

    /**
     * Charges minus discount; the amount to add to the installment principal.
     */
    public BigDecimal netAdjustment() {
        return penalty.add(interest).subtract(discount);
    }

    public boolean isLate() {
        return daysLate > 0;
    }
}
