package com.flagship.amortization.accrual;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily rate that replaces the tier rate for every day strictly after {@code changeDate}.
 */
@Value
public class RateChange {
    LocalDate changeDate;
    BigDecimal dailyRate;

    public static RateChange of(LocalDate changeDate, String dailyRate) {
        return new RateChange(changeDate, new BigDecimal(dailyRate));
    }
}
