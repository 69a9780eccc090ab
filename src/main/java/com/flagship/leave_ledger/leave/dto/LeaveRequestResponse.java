package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.calendar.HalfDay;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.workflow.ApprovalStep;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import com.flagship.leave_ledger.workflow.WorkflowMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaveRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("leave_type_id")
    UUID leaveTypeId;

    @JsonProperty("leave_type_code")
    String leaveTypeCode;

    @JsonProperty("leave_type_label")
    String leaveTypeLabel;

    /** Null when the request never touches a balance. */
    @JsonProperty("balance_type")
    BalanceType balanceType;

    @JsonProperty("balance_year")
    Integer balanceYear;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("start_half_day")
    HalfDay startHalfDay;

    @JsonProperty("end_half_day")
    HalfDay endHalfDay;

    @JsonProperty("total_days")
    BigDecimal totalDays;

    @JsonProperty("status")
    LeaveStatus status;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("exceptional_reason")
    String exceptionalReason;

    @JsonProperty("attachment_urls")
    List<String> attachmentUrls;

    @JsonProperty("workflow_mode")
    WorkflowMode workflowMode;

    @JsonProperty("submission_round")
    Integer submissionRound;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("steps")
    List<ApprovalStepResponse> steps;

    /**
     * Short form returned by intake: id, status and total days only.
     */
    public static LeaveRequestResponse summary(LeaveRequest request) {
        return LeaveRequestResponse.builder()
            .id(request.getId())
            .status(request.getStatus())
            .totalDays(request.getTotalDays())
            .build();
    }

    public static LeaveRequestResponse from(LeaveRequest request, List<ApprovalStep> steps) {
        return LeaveRequestResponse.builder()
            .id(request.getId())
            .employeeId(request.getEmployeeId())
            .leaveTypeId(request.getLeaveTypeId())
            .leaveTypeCode(request.getLeaveTypeCode())
            .leaveTypeLabel(request.getLeaveTypeLabel())
            .balanceType(request.getBalanceType())
            .balanceYear(request.getBalanceYear())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .startHalfDay(request.getStartHalfDay())
            .endHalfDay(request.getEndHalfDay())
            .totalDays(request.getTotalDays())
            .status(request.getStatus())
            .reason(request.getReason())
            .exceptionalReason(request.getExceptionalReason())
            .attachmentUrls(request.getAttachmentUrls())
            .workflowMode(request.getWorkflowMode())
            .submissionRound(request.getSubmissionRound())
            .submittedAt(request.getSubmittedAt())
            .createdAt(request.getCreatedAt())
            .updatedAt(request.getUpdatedAt())
            .steps(steps.stream().map(ApprovalStepResponse::from).toList())
            .build();
    }
}
