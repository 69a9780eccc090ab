package com.flagship.leave_ledger.consumer;

import com.flagship.leave_ledger.audit.AuditRecorder;
import com.flagship.leave_ledger.event.ApprovalReminderEvent;
import com.flagship.leave_ledger.event.BalanceMutationEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import com.flagship.leave_ledger.notification.NotificationDispatcher;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fans committed leave events out to the notification and audit channels.
 *
 * Delivery is best-effort: a failing channel is logged and counted, never
 * rethrown. The transition it describes has already committed and stays the
 * source of truth. Deduplication happens upstream in
 * {@link IdempotentEventProcessor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveEventHandler {

    static final String NOTIFICATION_CHANNEL = "notification";
    static final String AUDIT_CHANNEL = "audit";

    private final NotificationDispatcher notificationDispatcher;
    private final AuditRecorder auditRecorder;
    private final LeaveMetrics leaveMetrics;

    public void onTransition(WorkflowTransitionEvent event) {
        log.info("Handling {}: request={}, {} -> {}, actor={}",
                event.getEventType(), event.getRequestId(), event.getOldStatus(), event.getNewStatus(),
                event.getActorId());

        deliver(NOTIFICATION_CHANNEL, event.getEventType(), () -> notificationDispatcher.onTransition(event));
        deliver(AUDIT_CHANNEL, event.getEventType(), () -> auditRecorder.recordTransition(event));
    }

    public void onBalanceMutation(BalanceMutationEvent event) {
        log.debug("Handling {}: balance={}, mutation={}, delta={}",
                event.getEventType(), event.getBalanceId(), event.getMutation(), event.getDelta());

        deliver(AUDIT_CHANNEL, event.getEventType(), () -> auditRecorder.recordBalanceMutation(event));
    }

    public void onReminder(ApprovalReminderEvent event) {
        log.info("Handling {}: request={}, approvers={}",
                event.getEventType(), event.getRequestId(), event.getApproverIds());

        deliver(NOTIFICATION_CHANNEL, event.getEventType(), () -> notificationDispatcher.onReminder(event));
    }

    private void deliver(String channel, String eventType, Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            leaveMetrics.recordSideEffectFailure(channel, eventType);
            log.error("Failed {} delivery for {}: {}", channel, eventType, e.getMessage(), e);
        }
    }
}
