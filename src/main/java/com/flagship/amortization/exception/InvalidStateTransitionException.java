package com.flagship.amortization.exception;

/**
 * Raised when an installment cannot move from its current status to the requested one.
 */
public class InvalidStateTransitionException extends IllegalStateException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
