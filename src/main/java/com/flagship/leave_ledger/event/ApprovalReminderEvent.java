package com.flagship.leave_ledger.event;

import com.flagship.leave_ledger.workflow.LeaveStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Fact: the approvers of a long-pending request are due a reminder.
 */
@Value
@Builder
@Jacksonized
public class ApprovalReminderEvent implements LeaveEvent {

    public static final String EVENT_TYPE = "ApprovalReminderDue";

    UUID eventId;
    UUID requestId;
    UUID employeeId;
    LeaveStatus status;
    List<UUID> approverIds;
    String leaveTypeLabel;
    LocalDate startDate;
    LocalDate endDate;
    Instant pendingSince;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return requestId;
    }

    @Override
    public String getAggregateType() {
        return WorkflowTransitionEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
