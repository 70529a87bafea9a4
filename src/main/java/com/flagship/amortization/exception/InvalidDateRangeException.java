package com.flagship.amortization.exception;

/**
 * Raised when a date range ends before it starts.
 */
public class InvalidDateRangeException extends IllegalArgumentException {

    public InvalidDateRangeException(String message) {
        super(message);
    }
}
