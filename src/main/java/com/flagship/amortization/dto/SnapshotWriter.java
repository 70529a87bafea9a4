package com.flagship.amortization.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.amortization.payment.PaymentResult;
import com.flagship.amortization.schedule.Installment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders before/after JSON snapshots of installment transitions for the
 * caller's audit layer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotWriter {

    private final ObjectMapper objectMapper;

    public String write(Object response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize snapshot", e);
        }
    }

    /**
     * Snapshot of a payment: the installment before, the installment after,
     * and the residual when the payment was partial.
     */
    public String paymentSnapshot(Installment before, PaymentResult result) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("before", InstallmentResponse.from(before));
        snapshot.put("after", InstallmentResponse.from(result.getInstallment()));
        result.residual().ifPresent(residual -> snapshot.put("residual", InstallmentResponse.from(residual)));
        snapshot.put("amount_due", result.getAmountDue());
        snapshot.put("overpayment", result.getOverpayment());

        String json = write(snapshot);
        log.debug("Payment snapshot rendered: installmentId={}, bytes={}", before.getId(), json.length());
        return json;
    }
}
