package com.flagship.leave_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.LeaveBalance;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceAdjustmentResponse {

    @JsonProperty("new_total")
    BigDecimal newTotal;

    @JsonProperty("remaining")
    BigDecimal remaining;

    public static BalanceAdjustmentResponse from(LeaveBalance balance) {
        return new BalanceAdjustmentResponse(balance.getTotalDays(), balance.remaining());
    }
}
