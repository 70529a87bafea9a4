package com.flagship.amortization.accrual;

/**
 * Which late days accrue interest once the tolerance window is exceeded.
 */
public enum BillableDaysConvention {
    /**
     * Every day since the due date is billable; tolerance only decides whether
     * interest applies at all.
     */
    FULL_DAYS_LATE,

    /**
     * Only the days after the tolerance window are billable.
     */
    DAYS_BEYOND_TOLERANCE
}
