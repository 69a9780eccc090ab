package com.flagship.leave_ledger.workflow;

public enum ApprovalAction {
    APPROVED,
    REFUSED,
    RETURNED;

    public boolean requiresComment() {
        return this != APPROVED;
    }
}
