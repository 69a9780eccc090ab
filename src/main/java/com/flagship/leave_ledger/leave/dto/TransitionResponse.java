package com.flagship.leave_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import com.flagship.leave_ledger.workflow.TransitionResult;
import lombok.Value;

import java.util.UUID;

@Value
public class TransitionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("old_status")
    LeaveStatus oldStatus;

    @JsonProperty("new_status")
    LeaveStatus newStatus;

    public static TransitionResponse from(TransitionResult result) {
        return new TransitionResponse(result.getRequestId(), result.getOldStatus(), result.getNewStatus());
    }
}
