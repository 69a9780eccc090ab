package com.flagship.leave_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.balance.LeaveBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("year")
    int year;

    @JsonProperty("balance_type")
    BalanceType balanceType;

    @JsonProperty("total_days")
    BigDecimal totalDays;

    @JsonProperty("carried_over_days")
    BigDecimal carriedOverDays;

    @JsonProperty("used_days")
    BigDecimal usedDays;

    @JsonProperty("pending_days")
    BigDecimal pendingDays;

    @JsonProperty("remaining")
    BigDecimal remaining;

    public static BalanceResponse from(LeaveBalance balance) {
        return BalanceResponse.builder()
            .employeeId(balance.getEmployeeId())
            .year(balance.getYear())
            .balanceType(balance.getBalanceType())
            .totalDays(balance.getTotalDays())
            .carriedOverDays(balance.getCarriedOverDays())
            .usedDays(balance.getUsedDays())
            .pendingDays(balance.getPendingDays())
            .remaining(balance.remaining())
            .build();
    }
}
