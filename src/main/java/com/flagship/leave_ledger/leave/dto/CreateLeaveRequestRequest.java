package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.calendar.HalfDay;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class CreateLeaveRequestRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Leave type ID is required")
    @JsonProperty("leave_type_id")
    UUID leaveTypeId;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("start_half_day")
    HalfDay startHalfDay;

    @JsonProperty("end_half_day")
    HalfDay endHalfDay;

    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    @JsonProperty("reason")
    String reason;

    @Size(max = 2000, message = "Exceptional reason must be at most 2000 characters")
    @JsonProperty("exceptional_reason")
    String exceptionalReason;

    @JsonProperty("attachment_urls")
    List<@Size(max = 1000) String> attachmentUrls;

    /** Keeps the request as a draft instead of submitting it. */
    @JsonProperty("as_draft")
    Boolean asDraft;
}
