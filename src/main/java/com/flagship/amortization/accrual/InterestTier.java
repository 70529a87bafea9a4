package com.flagship.amortization.accrual;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Daily rate that applies from a number of days late onwards.
 */
@Value
public class InterestTier {
    int minDaysLate;
    BigDecimal dailyRate;

    public static InterestTier of(int minDaysLate, String dailyRate) {
        return new InterestTier(minDaysLate, new BigDecimal(dailyRate));
    }
}
