package com.flagship.amortization.accrual;

/**
 * How daily interest accumulates over the billable days.
 */
public enum AccrualModel {
    /**
     * amount * rate * days
     */
    SIMPLE,

    /**
     * amount * ((1 + rate)^days - 1), principal carried forward between rate periods
     */
    COMPOUND
}
