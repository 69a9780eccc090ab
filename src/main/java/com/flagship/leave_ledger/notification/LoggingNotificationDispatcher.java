package com.flagship.leave_ledger.notification;

import com.flagship.leave_ledger.event.ApprovalReminderEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs the message each recipient would get. Email delivery lives outside
 * this service.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void onTransition(WorkflowTransitionEvent event) {
        if (!event.isStatusChange()) {
            log.debug("Leave request {}: decision recorded by {}, stage still {}",
                    event.getRequestId(), event.getActorId(), event.getNewStatus());
            return;
        }

        LeaveStatus newStatus = event.getNewStatus();
        if (newStatus.isPending()) {
            log.info("Would notify approvers {}: {} request {} ({} to {}) awaits their decision",
                    event.getNextApproverIds(), event.getLeaveTypeLabel(), event.getRequestId(),
                    event.getStartDate(), event.getEndDate());
        } else {
            log.info("Would notify employee {}: {} request {} ({} to {}) is now {}{}",
                    event.getEmployeeId(), event.getLeaveTypeLabel(), event.getRequestId(),
                    event.getStartDate(), event.getEndDate(), newStatus,
                    event.getComment() != null ? " (" + event.getComment() + ")" : "");
        }
    }

    @Override
    public void onReminder(ApprovalReminderEvent event) {
        log.info("Would remind approvers {}: {} request {} ({} to {}) pending since {}",
                event.getApproverIds(), event.getLeaveTypeLabel(), event.getRequestId(),
                event.getStartDate(), event.getEndDate(), event.getPendingSince());
    }
}
