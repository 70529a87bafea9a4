package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Expected receipts, expenses and closing balance over a period, recurring entries included.
 */
@Value
public class BalanceForecast {
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    BigDecimal inflow;
    BigDecimal outflow;
    BigDecimal closingBalance;
    int entryCount;

    public BigDecimal net() {
        return inflow.subtract(outflow);
    }
}
