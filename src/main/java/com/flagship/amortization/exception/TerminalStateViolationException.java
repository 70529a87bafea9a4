package com.flagship.amortization.exception;

import com.flagship.amortization.schedule.InstallmentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Raised when a payment or cancellation targets an installment that is already
 * PAID or CANCELLED. Terminal installments accept no further events.
 */
@Getter
public class TerminalStateViolationException extends IllegalStateException {

    private final UUID installmentId;
    private final InstallmentStatus status;

    public TerminalStateViolationException(UUID installmentId, InstallmentStatus status, String operation) {
        super(String.format("Cannot %s installment %s in %s status. %s is a terminal state.",
            operation, installmentId, status, status));
        this.installmentId = installmentId;
        this.status = status;
    }
}
