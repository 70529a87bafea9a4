package com.flagship.amortization.accrual;

import com.flagship.amortization.exception.PolicyTierGapException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Late-payment and early-payment rules for an installment.
 *
 * Validated at construction:
 * - at least one tier, distinct thresholds, non-negative rates
 * - tier rates never decrease as days late grow
 * - rate changes in strictly ascending date order
 * - penalty between 0 and 1, tolerance not negative
 *
 * Tier mode defaults to FLAT and day count basis to CALENDAR_DAYS when not given.
 */
@Value
public class InterestPolicy {
    List<InterestTier> tiers;
    int toleranceDays;
    AccrualModel accrualModel;
    BigDecimal penaltyPercent;
    BigDecimal earlyPaymentDiscountRate;
    TierMode tierMode;
    List<RateChange> rateChanges;
    DayCountBasis dayCountBasis;

    @Builder
    private InterestPolicy(@Singular List<InterestTier> tiers,
                           int toleranceDays,
                           AccrualModel accrualModel,
                           BigDecimal penaltyPercent,
                           BigDecimal earlyPaymentDiscountRate,
                           TierMode tierMode,
                           @Singular List<RateChange> rateChanges,
                           DayCountBasis dayCountBasis) {
        this.accrualModel = Objects.requireNonNull(accrualModel, "Accrual model is required");
        if (toleranceDays < 0) {
            throw new IllegalArgumentException("Tolerance days cannot be negative: " + toleranceDays);
        }
        this.toleranceDays = toleranceDays;
        this.tiers = validateTiers(tiers);
        this.penaltyPercent = validatePenalty(penaltyPercent);
        if (earlyPaymentDiscountRate != null && earlyPaymentDiscountRate.signum() < 0) {
            throw new IllegalArgumentException("Early payment discount rate cannot be negative");
        }
        this.earlyPaymentDiscountRate = earlyPaymentDiscountRate;
        this.tierMode = tierMode != null ? tierMode : TierMode.FLAT;
        this.rateChanges = validateRateChanges(rateChanges);
        this.dayCountBasis = dayCountBasis != null ? dayCountBasis : DayCountBasis.CALENDAR_DAYS;
    }

    public Optional<BigDecimal> penalty() {
        return Optional.ofNullable(penaltyPercent);
    }

    public Optional<BigDecimal> earlyPaymentDiscount() {
        return Optional.ofNullable(earlyPaymentDiscountRate);
    }

    /**
     * Tier with the greatest threshold not above {@code daysLate}.
     *
     * @throws PolicyTierGapException if every tier starts later than {@code daysLate}
     */
    public InterestTier tierFor(long daysLate) {
        InterestTier selected = null;
        for (InterestTier tier : tiers) {
            if (tier.getMinDaysLate() <= daysLate) {
                selected = tier;
            } else {
                break;
            }
        }
        if (selected == null) {
            throw new PolicyTierGapException(daysLate, tiers.get(0).getMinDaysLate());
        }
        return selected;
    }

    /**
     * Latest rate change whose date is strictly before {@code day}, if any.
     */
    public Optional<RateChange> rateChangeFor(LocalDate day) {
        RateChange selected = null;
        for (RateChange change : rateChanges) {
            if (change.getChangeDate().isBefore(day)) {
                selected = change;
            } else {
                break;
            }
        }
        return Optional.ofNullable(selected);
    }

    private static List<InterestTier> validateTiers(List<InterestTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Interest policy needs at least one tier");
        }
        List<InterestTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(InterestTier::getMinDaysLate));
        InterestTier previous = null;
        for (InterestTier tier : sorted) {
            Objects.requireNonNull(tier.getDailyRate(), "Tier daily rate is required");
            if (tier.getMinDaysLate() < 0) {
                throw new IllegalArgumentException("Tier threshold cannot be negative: " + tier.getMinDaysLate());
            }
            if (tier.getDailyRate().signum() < 0) {
                throw new IllegalArgumentException("Tier daily rate cannot be negative: " + tier.getDailyRate());
            }
            if (previous != null) {
                if (previous.getMinDaysLate() == tier.getMinDaysLate()) {
                    throw new IllegalArgumentException("Duplicate tier threshold: " + tier.getMinDaysLate());
                }
                if (tier.getDailyRate().compareTo(previous.getDailyRate()) < 0) {
                    throw new IllegalArgumentException(String.format(
                        "Tier starting at %d days has a lower rate (%s) than the tier before it (%s)",
                        tier.getMinDaysLate(), tier.getDailyRate(), previous.getDailyRate()));
                }
            }
            previous = tier;
        }
        return List.copyOf(sorted);
    }

    private static BigDecimal validatePenalty(BigDecimal penaltyPercent) {
        if (penaltyPercent == null) {
            return null;
        }
        if (penaltyPercent.signum() < 0 || penaltyPercent.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Penalty percent must be between 0 and 1: " + penaltyPercent);
        }
        return penaltyPercent;
    }

    private static List<RateChange> validateRateChanges(List<RateChange> rateChanges) {
        if (rateChanges == null || rateChanges.isEmpty()) {
            return List.of();
        }
        RateChange previous = null;
        for (RateChange change : rateChanges) {
            Objects.requireNonNull(change.getChangeDate(), "Rate change date is required");
            Objects.requireNonNull(change.getDailyRate(), "Rate change daily rate is required");
            if (change.getDailyRate().signum() < 0) {
                throw new IllegalArgumentException("Rate change daily rate cannot be negative");
            }
            if (previous != null && !change.getChangeDate().isAfter(previous.getChangeDate())) {
                throw new IllegalArgumentException(
                    "Rate changes must be in ascending date order: " + change.getChangeDate());
            }
            previous = change;
        }
        return List.copyOf(rateChanges);
    }
}
