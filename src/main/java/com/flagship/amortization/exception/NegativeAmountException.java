package com.flagship.amortization.exception;

/**
 * Raised when a monetary input that must be positive (or non-negative) is not.
 */
public class NegativeAmountException extends IllegalArgumentException {

    public NegativeAmountException(String message) {
        super(message);
    }
}
