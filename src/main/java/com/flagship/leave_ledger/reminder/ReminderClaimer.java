package com.flagship.leave_ledger.reminder;

import com.flagship.leave_ledger.event.ApprovalReminderEvent;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.leave.LeaveRequestPersistenceService;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import com.flagship.leave_ledger.outbox.OutboxService;
import com.flagship.leave_ledger.workflow.ApprovalStep;
import com.flagship.leave_ledger.workflow.ApprovalWorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Claims one reminder: stamps last_reminder_sent_at and writes the reminder
 * event to the outbox in one transaction.
 *
 * The stamp is a guarded UPDATE that re-checks eligibility, so of two
 * overlapping runs only one sees a row come back. The loser writes nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderClaimer {

    private final JdbcTemplate jdbcTemplate;
    private final LeaveRequestPersistenceService persistenceService;
    private final ApprovalWorkflowEngine workflowEngine;
    private final OutboxService outboxService;
    private final LeaveMetrics leaveMetrics;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claim(UUID leaveRequestId, Instant now, Instant pendingBefore, Instant remindedBefore) {
        List<UUID> claimed = jdbcTemplate.query(
            "UPDATE leave_requests SET last_reminder_sent_at = ? " +
            "WHERE id = ? AND status IN ('PENDING_MANAGER', 'PENDING_HR') AND submitted_at < ? " +
            "AND (last_reminder_sent_at IS NULL OR last_reminder_sent_at < ?) RETURNING id",
            (rs, rowNum) -> UUID.fromString(rs.getString("id")),
            Timestamp.from(now), leaveRequestId, Timestamp.from(pendingBefore), Timestamp.from(remindedBefore)
        );

        if (claimed.isEmpty()) {
            log.debug("Reminder for leave request {} already claimed or no longer due", leaveRequestId);
            return false;
        }

        LeaveRequest request = persistenceService.getById(leaveRequestId);
        List<UUID> approverIds = workflowEngine.actionableSteps(request).stream()
            .map(ApprovalStep::getApproverId)
            .distinct()
            .toList();

        ApprovalReminderEvent event = ApprovalReminderEvent.builder()
            .eventId(UUID.randomUUID())
            .requestId(request.getId())
            .employeeId(request.getEmployeeId())
            .status(request.getStatus())
            .approverIds(approverIds)
            .leaveTypeLabel(request.getLeaveTypeLabel())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .pendingSince(request.getSubmittedAt())
            .occurredAt(now)
            .build();
        outboxService.saveEvent(event);
        leaveMetrics.recordReminderClaimed();

        log.info("Reminder claimed for leave request {}: status={}, approvers={}",
                leaveRequestId, request.getStatus(), approverIds);
        return true;
    }
}
