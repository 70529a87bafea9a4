package com.flagship.amortization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.amortization.cashflow.CashflowDay;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class CashflowDayResponse {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("inflow")
    BigDecimal inflow;

    @JsonProperty("outflow")
    BigDecimal outflow;

    @JsonProperty("daily_balance")
    BigDecimal dailyBalance;

    @JsonProperty("running_balance")
    BigDecimal runningBalance;

    public static CashflowDayResponse from(CashflowDay day) {
        return CashflowDayResponse.builder()
            .date(day.getDate())
            .inflow(day.getInflow())
            .outflow(day.getOutflow())
            .dailyBalance(day.getDailyBalance())
            .runningBalance(day.getRunningBalance())
            .build();
    }
}
