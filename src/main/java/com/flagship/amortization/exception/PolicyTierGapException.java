package com.flagship.amortization.exception;

import lombok.Getter;

/**
 * Raised when no interest tier covers a given number of days late.
 */
@Getter
public class PolicyTierGapException extends IllegalStateException {

    private final long daysLate;

    public PolicyTierGapException(long daysLate, int lowestTier) {
        super(String.format("No interest tier covers %d days late. Lowest configured tier starts at %d days.",
            daysLate, lowestTier));
        this.daysLate = daysLate;
    }
}
