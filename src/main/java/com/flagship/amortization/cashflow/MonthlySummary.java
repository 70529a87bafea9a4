package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Receipts and expenses of one month with the balance carried in and out.
 */
@Value
public class MonthlySummary {
    YearMonth month;
    BigDecimal openingBalance;
    BigDecimal inflow;
    BigDecimal outflow;
    BigDecimal closingBalance;
}
