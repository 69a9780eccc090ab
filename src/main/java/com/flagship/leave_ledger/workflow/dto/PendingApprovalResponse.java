package com.flagship.leave_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.workflow.ApprovalInboxService.PendingApproval;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import com.flagship.leave_ledger.workflow.StepType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PendingApprovalResponse {

    @JsonProperty("step_id")
    UUID stepId;

    @JsonProperty("leave_request_id")
    UUID leaveRequestId;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("step_type")
    StepType stepType;

    @JsonProperty("step_order")
    int stepOrder;

    @JsonProperty("approver_id")
    UUID approverId;

    /** True when the actor sees this step through a delegation. */
    @JsonProperty("delegated")
    boolean delegated;

    @JsonProperty("status")
    LeaveStatus status;

    @JsonProperty("leave_type_label")
    String leaveTypeLabel;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("total_days")
    BigDecimal totalDays;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    public static PendingApprovalResponse from(PendingApproval pending) {
        return PendingApprovalResponse.builder()
            .stepId(pending.getStep().getId())
            .leaveRequestId(pending.getRequest().getId())
            .employeeId(pending.getRequest().getEmployeeId())
            .stepType(pending.getStep().getStepType())
            .stepOrder(pending.getStep().getStepOrder())
            .approverId(pending.getStep().getApproverId())
            .delegated(pending.isDelegated())
            .status(pending.getRequest().getStatus())
            .leaveTypeLabel(pending.getRequest().getLeaveTypeLabel())
            .startDate(pending.getRequest().getStartDate())
            .endDate(pending.getRequest().getEndDate())
            .totalDays(pending.getRequest().getTotalDays())
            .submittedAt(pending.getRequest().getSubmittedAt())
            .build();
    }
}
