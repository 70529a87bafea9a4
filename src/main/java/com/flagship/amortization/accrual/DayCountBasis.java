package com.flagship.amortization.accrual;

/**
 * Which days in the billable window count towards interest.
 */
public enum DayCountBasis {
    CALENDAR_DAYS,

    /**
     * Only business days count; requires a holiday calendar at accrual time.
     */
    BUSINESS_DAYS
}
