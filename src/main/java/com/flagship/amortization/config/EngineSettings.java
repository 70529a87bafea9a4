package com.flagship.amortization.config;

import com.flagship.amortization.accrual.BillableDaysConvention;
import com.flagship.amortization.money.MoneyRounding;
import com.flagship.amortization.schedule.DueDateAdjustment;
import lombok.Builder;
import lombok.Value;

import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable engine options handed to every calculation component.
 *
 * All three options are required; there are no defaults.
 */
@Value
public class EngineSettings {
    RoundingMode roundingMode;
    DueDateAdjustment dueDateAdjustment;
    BillableDaysConvention billableDaysConvention;

    @Builder
    private EngineSettings(RoundingMode roundingMode,
                           DueDateAdjustment dueDateAdjustment,
                           BillableDaysConvention billableDaysConvention) {
        this.roundingMode = Objects.requireNonNull(roundingMode, "roundingMode is required");
        this.dueDateAdjustment = Objects.requireNonNull(dueDateAdjustment, "dueDateAdjustment is required");
        this.billableDaysConvention = Objects.requireNonNull(billableDaysConvention,
            "billableDaysConvention is required");
        // rejects modes other than HALF_UP / HALF_EVEN
        new MoneyRounding(roundingMode);
    }

    public MoneyRounding rounding() {
        return new MoneyRounding(roundingMode);
    }
}
