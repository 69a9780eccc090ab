package com.flagship.leave_ledger.workflow;

import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Approval workflow of an office, or of a team overriding its office.
 */
@Value
public class WorkflowConfig {
    UUID id;
    WorkflowMode mode;
    List<WorkflowStepDefinition> steps;

    /**
     * Used when neither the team nor the office configures a workflow.
     */
    public static WorkflowConfig defaultConfig() {
        return new WorkflowConfig(null, WorkflowMode.SEQUENTIAL, List.of(
            new WorkflowStepDefinition(1, StepType.MANAGER, true, null),
            new WorkflowStepDefinition(2, StepType.HR, true, null)
        ));
    }

    /**
     * Steps that take part in approval, in stepOrder. Optional steps are not materialized.
     */
    public List<WorkflowStepDefinition> requiredSteps() {
        return steps.stream()
            .filter(WorkflowStepDefinition::isRequired)
            .sorted(Comparator.comparingInt(WorkflowStepDefinition::getStepOrder))
            .toList();
    }
}
