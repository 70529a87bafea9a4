package com.flagship.amortization.exception;

/**
 * Raised when an amortization plan's installments no longer match its total,
 * or when installment numbering is duplicated.
 */
public class PlanConsistencyException extends IllegalStateException {

    public PlanConsistencyException(String message) {
        super(message);
    }
}
