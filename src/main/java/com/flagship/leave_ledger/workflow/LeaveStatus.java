package com.flagship.leave_ledger.workflow;

/**
 * Lifecycle of a leave request.
 *
 * DRAFT -> PENDING_MANAGER -> [PENDING_HR] -> APPROVED, with REFUSED and
 * RETURNED reachable from either pending state and CANCELLED from any
 * non-terminal state. RETURNED goes back to the employee for revision and
 * can be resubmitted like a draft.
 */
public enum LeaveStatus {
    DRAFT,
    PENDING_MANAGER,
    PENDING_HR,
    APPROVED,
    REFUSED,
    RETURNED,
    CANCELLED;

    public boolean isTerminal() {
        return this == APPROVED || this == REFUSED || this == CANCELLED;
    }

    /**
     * Days are reserved on the balance exactly while a request is pending.
     */
    public boolean isPending() {
        return this == PENDING_MANAGER || this == PENDING_HR;
    }

    /**
     * The employee may edit and (re)submit.
     */
    public boolean isEditable() {
        return this == DRAFT || this == RETURNED;
    }

    public StepType awaitedStepType() {
        return switch (this) {
            case PENDING_MANAGER -> StepType.MANAGER;
            case PENDING_HR -> StepType.HR;
            default -> null;
        };
    }
}
