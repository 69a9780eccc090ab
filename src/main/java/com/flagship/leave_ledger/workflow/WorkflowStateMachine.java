package com.flagship.leave_ledger.workflow;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes a request's status from a consistent view of all steps of its
 * current submission round.
 *
 * Precedence: any REFUSED step wins, then any RETURNED step, then "no step
 * left undecided" means APPROVED. Otherwise the request waits on a stage:
 * <ul>
 *   <li>SEQUENTIAL: the type of the lowest-order undecided step</li>
 *   <li>PARALLEL: the current stage while any step of that type is undecided,
 *       then the type of the lowest-order undecided step</li>
 * </ul>
 *
 * Pure and stateless: callers hold the request lock while evaluating.
 */
@Component
public class WorkflowStateMachine {

    public LeaveStatus evaluate(WorkflowMode mode, LeaveStatus current, List<ApprovalStep> steps) {
        if (steps.stream().anyMatch(step -> step.getAction() == ApprovalAction.REFUSED)) {
            return LeaveStatus.REFUSED;
        }
        if (steps.stream().anyMatch(step -> step.getAction() == ApprovalAction.RETURNED)) {
            return LeaveStatus.RETURNED;
        }

        Optional<ApprovalStep> firstUndecided = firstUndecided(steps);
        if (firstUndecided.isEmpty()) {
            return LeaveStatus.APPROVED;
        }

        if (mode == WorkflowMode.PARALLEL && current.isPending()) {
            StepType currentStage = current.awaitedStepType();
            boolean stageOpen = steps.stream()
                .anyMatch(step -> !step.isDecided() && step.getStepType() == currentStage);
            if (stageOpen) {
                return current;
            }
        }

        return firstUndecided.get().getStepType().pendingStatus();
    }

    /**
     * Whether the step may be decided now.
     * Sequential: only the lowest-order undecided step(s). Parallel: every
     * undecided step of the current stage's type.
     */
    public boolean isActionable(WorkflowMode mode, LeaveStatus current, List<ApprovalStep> steps, ApprovalStep step) {
        if (!current.isPending() || step.isDecided() || step.isClosed()) {
            return false;
        }
        if (step.getStepType() != current.awaitedStepType()) {
            return false;
        }
        if (mode == WorkflowMode.PARALLEL) {
            return true;
        }
        return firstUndecided(steps)
            .map(first -> first.getStepOrder() == step.getStepOrder())
            .orElse(false);
    }

    public List<ApprovalStep> actionableSteps(WorkflowMode mode, LeaveStatus current, List<ApprovalStep> steps) {
        return steps.stream()
            .filter(step -> isActionable(mode, current, steps, step))
            .toList();
    }

    private Optional<ApprovalStep> firstUndecided(List<ApprovalStep> steps) {
        return steps.stream()
            .filter(step -> !step.isDecided())
            .min(Comparator.comparingInt(ApprovalStep::getStepOrder));
    }
}
