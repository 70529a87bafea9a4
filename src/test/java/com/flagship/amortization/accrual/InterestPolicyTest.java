package com.flagship.amortization.accrual;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InterestPolicyTest {

    @Test
    @DisplayName("Defaults: flat tiers, calendar days, no penalty, no discount")
    void testDefaults() {
        InterestPolicy policy = InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .accrualModel(AccrualModel.SIMPLE)
            .build();

        assertEquals(TierMode.FLAT, policy.getTierMode());
        assertEquals(DayCountBasis.CALENDAR_DAYS, policy.getDayCountBasis());
        assertTrue(policy.penalty().isEmpty());
        assertTrue(policy.earlyPaymentDiscount().isEmpty());
        assertTrue(policy.getRateChanges().isEmpty());
    }

    @Test
    @DisplayName("Tiers are sorted and selected by threshold")
    void testTierSelection() {
        InterestPolicy policy = InterestPolicy.builder()
            .tier(InterestTier.of(30, "0.003"))
            .tier(InterestTier.of(0, "0.001"))
            .tier(InterestTier.of(10, "0.002"))
            .accrualModel(AccrualModel.SIMPLE)
            .build();

        assertEquals(0, policy.getTiers().get(0).getMinDaysLate());
        assertEquals(new BigDecimal("0.001"), policy.tierFor(9).getDailyRate());
        assertEquals(new BigDecimal("0.002"), policy.tierFor(10).getDailyRate());
        assertEquals(new BigDecimal("0.003"), policy.tierFor(365).getDailyRate());
    }

    @Test
    @DisplayName("Rate change takes effect the day after its date")
    void testRateChangeSelection() {
        InterestPolicy policy = InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .accrualModel(AccrualModel.SIMPLE)
            .rateChange(RateChange.of(LocalDate.of(2023, 3, 6), "0.002"))
            .rateChange(RateChange.of(LocalDate.of(2023, 3, 20), "0.003"))
            .build();

        assertTrue(policy.rateChangeFor(LocalDate.of(2023, 3, 6)).isEmpty());
        assertEquals(new BigDecimal("0.002"), policy.rateChangeFor(LocalDate.of(2023, 3, 7)).orElseThrow().getDailyRate());
        assertEquals(new BigDecimal("0.003"), policy.rateChangeFor(LocalDate.of(2023, 4, 1)).orElseThrow().getDailyRate());
    }

    @Test
    @DisplayName("Invalid policies are rejected at construction")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(NullPointerException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.002"))
            .tier(InterestTier.of(10, "0.001"))
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .tier(InterestTier.of(0, "0.002"))
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "-0.001"))
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .toleranceDays(-1)
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .penaltyPercent(new BigDecimal("1.5"))
            .accrualModel(AccrualModel.SIMPLE)
            .build());

        assertThrows(IllegalArgumentException.class, () -> InterestPolicy.builder()
            .tier(InterestTier.of(0, "0.001"))
            .rateChange(RateChange.of(LocalDate.of(2023, 3, 20), "0.003"))
            .rateChange(RateChange.of(LocalDate.of(2023, 3, 6), "0.002"))
            .accrualModel(AccrualModel.SIMPLE)
            .build());
    }
}
