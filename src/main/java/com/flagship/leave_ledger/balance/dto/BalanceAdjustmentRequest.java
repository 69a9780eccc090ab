package com.flagship.leave_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.BalanceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Manual correction of a balance total. Year defaults to the current year.
 */
@Value
public class BalanceAdjustmentRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("year")
    Integer year;

    @NotNull(message = "Balance type is required")
    @JsonProperty("balance_type")
    BalanceType balanceType;

    @NotNull(message = "Adjustment is required")
    @JsonProperty("adjustment")
    BigDecimal adjustment;

    @NotBlank(message = "Reason is required")
    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    String reason;
}
