package com.flagship.leave_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.BalanceType;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CarryOverRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Source year is required")
    @JsonProperty("from_year")
    Integer fromYear;

    @NotNull(message = "Balance type is required")
    @JsonProperty("balance_type")
    BalanceType balanceType;
}
