package com.flagship.amortization.schedule;

/**
 * Lifecycle status of an installment.
 *
 * PENDING and PARTIALLY_PAID are stored; OVERDUE is normally derived on read
 * from the due date and the tolerance window. PAID and CANCELLED are terminal.
 */
public enum InstallmentStatus {
    /**
     * Open obligation, not yet due or still inside the tolerance window.
     */
    PENDING,

    /**
     * Part of the amount due was paid; the balance moved to a residual installment.
     * Further payments settle against what is still owed.
     */
    PARTIALLY_PAID,

    /**
     * Fully settled.
     * Terminal state - no further transitions allowed.
     */
    PAID,

    /**
     * Open and past the tolerance window.
     */
    OVERDUE,

    /**
     * Withdrawn without payment.
     * Terminal state - no further transitions allowed.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }

    public boolean isOpen() {
        return this == PENDING || this == OVERDUE;
    }
}
