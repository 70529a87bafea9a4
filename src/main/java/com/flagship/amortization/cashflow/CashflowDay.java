package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Totals of one day in a projection.
 */
@Value
public class CashflowDay {
    LocalDate date;
    BigDecimal inflow;
    BigDecimal outflow;
    BigDecimal dailyBalance;
    BigDecimal runningBalance;
}
