package com.flagship.amortization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.amortization.schedule.Installment;
import com.flagship.amortization.schedule.InstallmentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Snapshot of an installment for reporting and audit trails.
 */
@Value
@Builder
public class InstallmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("plan_id")
    UUID planId;

    @JsonProperty("label")
    String label;

    @JsonProperty("sequence_number")
    int sequenceNumber;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("paid_date")
    LocalDate paidDate;

    @JsonProperty("status")
    InstallmentStatus status;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    public static InstallmentResponse from(Installment installment) {
        return InstallmentResponse.builder()
            .id(installment.getId())
            .planId(installment.getPlanId())
            .label(installment.label())
            .sequenceNumber(installment.getSequenceNumber())
            .parentId(installment.getParentId())
            .amount(installment.getAmount())
            .dueDate(installment.getDueDate())
            .paidAmount(installment.getPaidAmount())
            .paidDate(installment.getPaidDate())
            .status(installment.getStatus())
            .cancellationReason(installment.getCancellationReason())
            .build();
    }
}
