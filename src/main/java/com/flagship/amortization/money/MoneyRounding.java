package com.flagship.amortization.money;

import com.flagship.amortization.exception.MoneyPrecisionException;
import com.flagship.amortization.exception.NegativeAmountException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Single place where monetary values are rounded and validated.
 *
 * Amounts are BigDecimal with two decimal places (the minor unit). Intermediate
 * arithmetic runs at {@link #CALCULATION_CONTEXT} precision and is rounded once,
 * at output, with the configured rounding mode.
 */
public final class MoneyRounding {

    public static final int SCALE = 2;
    public static final MathContext CALCULATION_CONTEXT = MathContext.DECIMAL128;

    private final RoundingMode roundingMode;

    public MoneyRounding(RoundingMode roundingMode) {
        Objects.requireNonNull(roundingMode, "Rounding mode is required");
        if (roundingMode != RoundingMode.HALF_UP && roundingMode != RoundingMode.HALF_EVEN) {
            throw new IllegalArgumentException(
                "Unsupported rounding mode " + roundingMode + ". Only HALF_UP and HALF_EVEN are allowed.");
        }
        this.roundingMode = roundingMode;
    }

    public RoundingMode getRoundingMode() {
        return roundingMode;
    }

    /**
     * Rounds a value to the minor unit using the configured mode.
     */
    public BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, roundingMode);
    }

    /**
     * Divides at full precision and rounds the quotient to the minor unit.
     */
    public BigDecimal divide(BigDecimal dividend, int divisor) {
        return dividend.divide(BigDecimal.valueOf(divisor), SCALE, roundingMode);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }

    /**
     * Normalizes a caller-supplied amount to two decimals, rejecting values that
     * would lose precision.
     *
     * @throws MoneyPrecisionException if the amount has more than two significant decimals
     */
    public static BigDecimal normalize(BigDecimal amount, String field) {
        Objects.requireNonNull(amount, field + " is required");
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new MoneyPrecisionException(
                String.format("%s must have at most %d decimal places: %s", field, SCALE, amount.toPlainString()));
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Normalizes and requires a strictly positive amount.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        BigDecimal normalized = normalize(amount, field);
        if (normalized.signum() <= 0) {
            throw new NegativeAmountException(field + " must be positive: " + normalized.toPlainString());
        }
        return normalized;
    }

    /**
     * Normalizes and requires an amount that is zero or positive.
     */
    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        BigDecimal normalized = normalize(amount, field);
        if (normalized.signum() < 0) {
            throw new NegativeAmountException(field + " cannot be negative: " + normalized.toPlainString());
        }
        return normalized;
    }
}
