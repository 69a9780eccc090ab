package com.flagship.leave_ledger.workflow;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a workflow command.
 */
@Value
public class TransitionResult {
    UUID requestId;
    LeaveStatus oldStatus;
    LeaveStatus newStatus;

    public boolean isStatusChange() {
        return oldStatus != newStatus;
    }
}
