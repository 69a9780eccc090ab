package com.flagship.leave_ledger.notification;

import com.flagship.leave_ledger.event.ApprovalReminderEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;

/**
 * Tells people about leave requests: the next approvers when a request
 * reaches their stage, the employee when it is decided.
 *
 * Called after the transition has committed. Implementations may throw; the
 * caller logs and counts the failure and moves on.
 */
public interface NotificationDispatcher {

    void onTransition(WorkflowTransitionEvent event);

    void onReminder(ApprovalReminderEvent event);
}
