package com.flagship.leave_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.BalanceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Opens a yearly account. Without total_days the office default applies,
 * prorated by hire month.
 */
@Value
public class OpenBalanceRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Year is required")
    @JsonProperty("year")
    Integer year;

    @NotNull(message = "Balance type is required")
    @JsonProperty("balance_type")
    BalanceType balanceType;

    @DecimalMin(value = "0.0", message = "Total days must be zero or more")
    @JsonProperty("total_days")
    BigDecimal totalDays;
}
