package com.flagship.leave_ledger.audit;

import com.flagship.leave_ledger.event.BalanceMutationEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;

/**
 * Durable trail of who did what: actor, action, entity, before and after.
 */
public interface AuditRecorder {

    void recordTransition(WorkflowTransitionEvent event);

    void recordBalanceMutation(BalanceMutationEvent event);
}
