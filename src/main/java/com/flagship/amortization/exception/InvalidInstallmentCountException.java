package com.flagship.amortization.exception;

/**
 * Raised when an amount cannot be split into the requested number of installments.
 */
public class InvalidInstallmentCountException extends IllegalArgumentException {

    public InvalidInstallmentCountException(String message) {
        super(message);
    }
}
