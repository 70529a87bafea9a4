package com.flagship.amortization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.amortization.accrual.AccrualBreakdown;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Accrual figures for one installment as of a date.
 */
@Value
@Builder
public class AccrualResponse {

    @JsonProperty("installment_id")
    UUID installmentId;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("penalty")
    BigDecimal penalty;

    @JsonProperty("interest")
    BigDecimal interest;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("net_adjustment")
    BigDecimal netAdjustment;

    @JsonProperty("days_late")
    long daysLate;

    @JsonProperty("days_early")
    long daysEarly;

    @JsonProperty("billable_days")
    long billableDays;

    @JsonProperty("within_tolerance")
    boolean withinTolerance;

    public static AccrualResponse from(UUID installmentId, LocalDate asOf, AccrualBreakdown breakdown) {
        return AccrualResponse.builder()
            .installmentId(installmentId)
            .asOf(asOf)
            .penalty(breakdown.getPenalty())
            .interest(breakdown.getInterest())
            .discount(breakdown.getDiscount())
            .netAdjustment(breakdown.netAdjustment())
            .daysLate(breakdown.getDaysLate())
            .daysEarly(breakdown.getDaysEarly())
            .billableDays(breakdown.getBillableDays())
            .withinTolerance(breakdown.isWithinTolerance())
            .build();
    }
}
