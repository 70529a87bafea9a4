package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Totals of the entries sharing one category, cost center or account.
 *
 * {@code share} is this group's movement (inflow + outflow) as a fraction of
 * the movement of all groups, four decimals.
 */
@Value
public class GroupSummary {
    String key;
    BigDecimal inflow;
    BigDecimal outflow;
    BigDecimal net;
    BigDecimal share;
    int entryCount;

    public BigDecimal movement() {
        return inflow.add(outflow);
    }
}
