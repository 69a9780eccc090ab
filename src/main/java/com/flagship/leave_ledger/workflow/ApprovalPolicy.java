package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.directory.DelegationDirectory;
import com.flagship.leave_ledger.exception.ApprovalAuthorizationException;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Single place that answers "may this actor do this to this request".
 *
 * Rules:
 * - CREATE, SUBMIT, REVISE, CANCEL: the owner of the request only
 * - DECIDE_*: the step's assigned approver, or a user holding an active
 *   delegation from that approver today; never the requester themself
 *
 * Whether the step is actionable right now (right stage, right order) is a
 * separate question answered by {@link WorkflowStateMachine}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApprovalPolicy {

    private final DelegationDirectory delegationDirectory;
    private final LeaveMetrics leaveMetrics;

    /**
     * @param step the step being decided; ignored for non-decision actions
     */
    public boolean can(UUID actorId, WorkflowAction action, LeaveRequest request, ApprovalStep step) {
        if (actorId == null) {
            return false;
        }
        if (!action.isDecision()) {
            return actorId.equals(request.getEmployeeId());
        }
        if (step == null || WorkflowAction.decide(step.getStepType()) != action) {
            return false;
        }
        if (actorId.equals(request.getEmployeeId())) {
            return false;
        }
        return actorId.equals(step.getApproverId())
            || delegationDirectory.isDelegate(step.getApproverId(), actorId, LocalDate.now());
    }

    /**
     * @throws ApprovalAuthorizationException if {@link #can} says no
     */
    public void require(UUID actorId, WorkflowAction action, LeaveRequest request, ApprovalStep step) {
        if (can(actorId, action, request, step)) {
            return;
        }
        leaveMetrics.recordAuthorizationDenied(action.name());
        log.warn("SECURITY: actor {} denied {} on leave request {} (step={})",
                actorId, action, request.getId(), step != null ? step.getId() : null);
        throw new ApprovalAuthorizationException(actorId, request.getId(),
                String.format("Actor %s is not allowed to %s leave request %s",
                        actorId, action.name().toLowerCase().replace('_', ' '), request.getId()));
    }
}
