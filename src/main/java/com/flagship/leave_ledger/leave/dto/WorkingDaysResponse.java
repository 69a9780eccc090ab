package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.leave.WorkingDaysPreview;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class WorkingDaysResponse {

    @JsonProperty("total_days")
    BigDecimal totalDays;

    /** Holidays of the office falling inside the range, sorted. */
    @JsonProperty("holidays")
    List<LocalDate> holidays;

    public static WorkingDaysResponse from(WorkingDaysPreview preview) {
        return new WorkingDaysResponse(preview.getTotalDays(), preview.getHolidays().stream().sorted().toList());
    }
}
