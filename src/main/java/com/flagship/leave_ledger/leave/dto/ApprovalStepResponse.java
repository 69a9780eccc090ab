package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.workflow.ApprovalAction;
import com.flagship.leave_ledger.workflow.ApprovalStep;
import com.flagship.leave_ledger.workflow.StepType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ApprovalStepResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("submission_round")
    int submissionRound;

    @JsonProperty("step_order")
    int stepOrder;

    @JsonProperty("step_type")
    StepType stepType;

    @JsonProperty("approver_id")
    UUID approverId;

    @JsonProperty("decided_by")
    UUID decidedBy;

    @JsonProperty("action")
    ApprovalAction action;

    @JsonProperty("comment")
    String comment;

    @JsonProperty("decided_at")
    Instant decidedAt;

    @JsonProperty("closed")
    boolean closed;

    public static ApprovalStepResponse from(ApprovalStep step) {
        return ApprovalStepResponse.builder()
            .id(step.getId())
            .submissionRound(step.getSubmissionRound())
            .stepOrder(step.getStepOrder())
            .stepType(step.getStepType())
            .approverId(step.getApproverId())
            .decidedBy(step.getDecidedBy())
            .action(step.getAction())
            .comment(step.getComment())
            .decidedAt(step.getDecidedAt())
            .closed(step.isClosed())
            .build();
    }
}
