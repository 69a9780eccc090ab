package com.flagship.leave_ledger.workflow;

/**
 * SEQUENTIAL: steps resolve strictly in stepOrder.
 * PARALLEL: every step of the current type is actionable at once; the type
 * clears when all of them are approved.
 */
public enum WorkflowMode {
    SEQUENTIAL,
    PARALLEL
}
