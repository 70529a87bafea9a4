package com.flagship.amortization.accrual;

/**
 * How interest tiers are applied to the days late.
 *
 * Tier thresholds always count days from the due date, under either
 * {@link BillableDaysConvention}. With DAYS_BEYOND_TOLERANCE the first billable
 * day is {@code toleranceDays + 1}, so a progressive policy only needs tiers
 * from that day on.
 */
public enum TierMode {
    /**
     * The tier matching the total days late applies to every billable day.
     */
    FLAT,

    /**
     * Each billable day accrues at the tier matching that day's position
     * (e.g. days 1-10 at the first tier, days 11-30 at the second).
     */
    PROGRESSIVE
}
