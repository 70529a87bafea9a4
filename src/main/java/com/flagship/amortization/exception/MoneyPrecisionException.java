package com.flagship.amortization.exception;

/**
 * Raised when a monetary input carries more decimal places than the currency's minor unit.
 */
public class MoneyPrecisionException extends IllegalArgumentException {

    public MoneyPrecisionException(String message) {
        super(message);
    }
}
