package com.flagship.leave_ledger.event;

import com.flagship.leave_ledger.workflow.ApprovalAction;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Fact: a command was applied to a leave request.
 *
 * Written to the outbox in the same transaction as the status change and
 * delivered to notification and audit consumers after commit. oldStatus equals
 * newStatus when a decision was recorded but the stage has not cleared yet.
 */
@Value
@Builder
@Jacksonized
public class WorkflowTransitionEvent implements LeaveEvent {

    public static final String EVENT_TYPE = "LeaveStatusChanged";
    public static final String AGGREGATE_TYPE = "LeaveRequest";

    UUID eventId;
    UUID requestId;
    UUID employeeId;
    LeaveStatus oldStatus;
    LeaveStatus newStatus;
    UUID actorId;
    String comment;
    UUID stepId;
    ApprovalAction action;
    String leaveTypeLabel;
    LocalDate startDate;
    LocalDate endDate;
    List<UUID> nextApproverIds;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return requestId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public boolean isStatusChange() {
        return oldStatus != newStatus;
    }
}
