package com.flagship.leave_ledger.workflow;

/**
 * Actions checked by {@link ApprovalPolicy}.
 */
public enum WorkflowAction {
    CREATE,
    SUBMIT,
    REVISE,
    CANCEL,
    DECIDE_MANAGER_STEP,
    DECIDE_HR_STEP;

    public static WorkflowAction decide(StepType stepType) {
        return switch (stepType) {
            case MANAGER -> DECIDE_MANAGER_STEP;
            case HR -> DECIDE_HR_STEP;
        };
    }

    public boolean isDecision() {
        return this == DECIDE_MANAGER_STEP || this == DECIDE_HR_STEP;
    }
}
