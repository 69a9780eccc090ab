package com.flagship.leave_ledger.workflow;

import lombok.Value;

import java.util.UUID;

/**
 * One configured step. approverId pins a specific approver; when null the
 * approver is resolved from the employee's team (MANAGER) or office (HR).
 */
@Value
public class WorkflowStepDefinition {
    int stepOrder;
    StepType stepType;
    boolean required;
    UUID approverId;
}
