package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.workflow.ApprovalAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * An approver's decision. The comment is mandatory for REFUSED and RETURNED,
 * which the workflow engine enforces.
 */
@Value
public class DecisionRequest {

    @NotNull(message = "Action is required")
    @JsonProperty("action")
    ApprovalAction action;

    @Size(max = 2000, message = "Comment must be at most 2000 characters")
    @JsonProperty("comment")
    String comment;
}
