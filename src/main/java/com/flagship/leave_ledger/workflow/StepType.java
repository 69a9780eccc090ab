package com.flagship.leave_ledger.workflow;

public enum StepType {
    MANAGER,
    HR;

    /**
     * The request status while a step of this type is awaited.
     */
    public LeaveStatus pendingStatus() {
        return switch (this) {
            case MANAGER -> LeaveStatus.PENDING_MANAGER;
            case HR -> LeaveStatus.PENDING_HR;
        };
    }
}
