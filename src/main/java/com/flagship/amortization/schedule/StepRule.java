package com.flagship.amortization.schedule;

import com.flagship.amortization.money.MoneyRounding;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * How the amount of a stepped schedule changes from one installment to the next.
 *
 * INCREMENT adds a fixed amount per installment (negative to step down).
 * GROWTH multiplies the previous amount by {@code 1 + rate}, rounding each step
 * to cents. Floor and cap bound every installment; the progression itself keeps
 * running unbounded, so a capped schedule stays at the cap.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StepRule {

    public enum Kind {
        INCREMENT,
        GROWTH
    }

    Kind kind;
    BigDecimal step;
    BigDecimal floor;
    BigDecimal cap;

    public static StepRule increment(BigDecimal amount) {
        return new StepRule(Kind.INCREMENT, MoneyRounding.normalize(amount, "Step increment"), null, null);
    }

    /**
     * @param rate Growth per installment as a fraction, 0.10 for 10%; greater than -1
     */
    public static StepRule growth(BigDecimal rate) {
        Objects.requireNonNull(rate, "Growth rate is required");
        if (rate.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new IllegalArgumentException("Growth rate must be greater than -100%: " + rate.toPlainString());
        }
        return new StepRule(Kind.GROWTH, rate, null, null);
    }

    public StepRule withFloor(BigDecimal floor) {
        BigDecimal normalized = MoneyRounding.requireNonNegative(floor, "Step floor");
        requireOrdered(normalized, cap);
        return new StepRule(kind, step, normalized, cap);
    }

    public StepRule withCap(BigDecimal cap) {
        BigDecimal normalized = MoneyRounding.requireNonNegative(cap, "Step cap");
        requireOrdered(floor, normalized);
        return new StepRule(kind, step, floor, normalized);
    }

    /**
     * Unbounded amount that follows {@code previous}.
     */
    BigDecimal next(BigDecimal previous, RoundingMode roundingMode) {
        return switch (kind) {
            case INCREMENT -> previous.add(step);
            case GROWTH -> previous.multiply(BigDecimal.ONE.add(step)).setScale(MoneyRounding.SCALE, roundingMode);
        };
    }

    BigDecimal bound(BigDecimal amount) {
        BigDecimal bounded = amount;
        if (floor != null) {
            bounded = bounded.max(floor);
        }
        if (cap != null) {
            bounded = bounded.min(cap);
        }
        return bounded;
    }

    private static void requireOrdered(BigDecimal floor, BigDecimal cap) {
        if (floor != null && cap != null && floor.compareTo(cap) > 0) {
            throw new IllegalArgumentException(String.format(
                "Step floor %s is above the cap %s", floor.toPlainString(), cap.toPlainString()));
        }
    }
}
