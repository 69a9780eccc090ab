package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.balance.LeaveBalanceLedger;
import com.flagship.leave_ledger.directory.EmployeeProfile;
import com.flagship.leave_ledger.directory.OrganizationDirectory;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import com.flagship.leave_ledger.exception.ApprovalAuthorizationException;
import com.flagship.leave_ledger.exception.InvalidTransitionException;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.leave.LeaveRequestPersistenceService;
import com.flagship.leave_ledger.observability.CorrelationContext;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import com.flagship.leave_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Drives a leave request through its approval workflow.
 *
 * Every command is one transaction that:
 * 1. Locks the request row (SELECT ... FOR UPDATE)
 * 2. Reads all steps of the current submission round
 * 3. Writes the step decision and the new request status
 * 4. Commits or releases the reserved balance days when the request leaves its pending state
 * 5. Writes a {@link WorkflowTransitionEvent} to the outbox
 *
 * Two approvers of a parallel stage deciding at the same instant are
 * serialized by the row lock, so exactly one of them sees the stage clear and
 * the ledger is touched exactly once. A refusal racing an approval resolves
 * the same way: whichever runs second sees the other's decision, and REFUSED
 * takes precedence in {@link WorkflowStateMachine#evaluate}.
 *
 * Notification and audit happen after commit, from the outbox, and can never
 * undo a transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalWorkflowEngine {

    private final LeaveRequestPersistenceService persistenceService;
    private final ApprovalStepRepository stepRepository;
    private final WorkflowStateMachine stateMachine;
    private final ApprovalPolicy approvalPolicy;
    private final ApproverResolver approverResolver;
    private final OrganizationDirectory organizationDirectory;
    private final LeaveBalanceLedger ledger;
    private final OutboxService outboxService;
    private final LeaveMetrics leaveMetrics;

    /**
     * Opens a new submission round on a request the caller has already locked
     * and validated: fresh steps, days reserved, first pending stage.
     *
     * A workflow without required steps approves at once, and the days are
     * reserved and committed in the same transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransitionResult startRound(LeaveRequest request, EmployeeProfile employee, UUID actorId) {
        LeaveStatus oldStatus = request.getStatus();
        if (!oldStatus.isEditable()) {
            throw new InvalidTransitionException(oldStatus, String.format(
                "Leave request %s cannot be submitted in %s status", request.getId(), oldStatus));
        }

        WorkflowConfig workflow = organizationDirectory.findWorkflow(employee.getOfficeId(), employee.getTeamId())
            .orElseGet(WorkflowConfig::defaultConfig);
        int round = request.getSubmissionRound() + 1;
        List<ApprovalStep> steps = approverResolver.materialize(
            request.getId(), round, employee, workflow.requiredSteps());
        LeaveStatus initialStatus = stateMachine.evaluate(workflow.getMode(), oldStatus, steps);

        LeaveRequest submitted = persistenceService.update(request.submit(workflow.getMode(), initialStatus));
        stepRepository.saveAll(steps.stream().map(ApprovalStepEntity::fromDomain).toList());

        if (submitted.chargesBalance()) {
            ledger.reserve(submitted.balanceKey(), submitted.getTotalDays(), submitted.getId());
            if (initialStatus == LeaveStatus.APPROVED) {
                ledger.commit(submitted.balanceKey(), submitted.getTotalDays(), submitted.getId());
            }
        }

        List<UUID> nextApprovers = approversOf(stateMachine.actionableSteps(workflow.getMode(), initialStatus, steps));
        publishTransition(submitted, oldStatus, initialStatus, actorId, null, null, null, nextApprovers);

        log.info("Leave request {} submitted (round {}, {} {} step(s)): {} -> {}",
                submitted.getId(), round, steps.size(), workflow.getMode(), oldStatus, initialStatus);
        return new TransitionResult(submitted.getId(), oldStatus, initialStatus);
    }

    /**
     * Records an approver's decision on one step and moves the request on.
     *
     * @throws LeaveValidationException if a REFUSED or RETURNED decision carries no comment
     * @throws InvalidTransitionException if the request is not pending or the step is already decided
     * @throws ApprovalAuthorizationException if the actor may not decide this step, or the step's stage is not active
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public TransitionResult decideStep(UUID requestId, UUID stepId, UUID actorId,
                                       ApprovalAction action, String comment) {
        long startTime = System.currentTimeMillis();
        if (action == null) {
            throw new LeaveValidationException("A decision is required");
        }
        String decisionComment = comment != null && !comment.isBlank() ? comment.trim() : null;
        if (action.requiresComment() && decisionComment == null) {
            throw new LeaveValidationException("A comment is required to " + action.name().toLowerCase() + " a step");
        }

        LeaveRequest request = persistenceService.lockForUpdate(requestId);
        CorrelationContext.putLeaveContext(requestId, request.getEmployeeId());
        try {
            LeaveStatus oldStatus = request.getStatus();
            List<ApprovalStep> steps = currentRound(request);
            ApprovalStep step = steps.stream()
                .filter(candidate -> candidate.getId().equals(stepId))
                .findFirst()
                .orElseThrow(() -> new InvalidTransitionException(oldStatus, String.format(
                    "Step %s is not part of the current submission of leave request %s", stepId, requestId)));

            // A wrong actor is refused whatever the state of the request or step
            approvalPolicy.require(actorId, WorkflowAction.decide(step.getStepType()), request, step);

            if (!oldStatus.isPending()) {
                throw new InvalidTransitionException(oldStatus, String.format(
                    "Leave request %s is %s and not awaiting a decision", requestId, oldStatus));
            }
            if (step.isDecided()) {
                throw new InvalidTransitionException(oldStatus, String.format(
                    "Step %s was already decided (%s)", stepId, step.getAction()));
            }

            WorkflowMode mode = request.getWorkflowMode();
            if (!stateMachine.isActionable(mode, oldStatus, steps, step)) {
                leaveMetrics.recordAuthorizationDenied("STEP_NOT_ACTIONABLE");
                log.warn("SECURITY: actor {} tried to decide {} step {} while request {} is {}",
                        actorId, step.getStepType(), stepId, requestId, oldStatus);
                throw new ApprovalAuthorizationException(actorId, requestId, String.format(
                    "Step %s (%s) is not awaiting a decision while the request is %s",
                    stepId, step.getStepType(), oldStatus));
            }

            ApprovalStep decided = step.decide(action, decisionComment, actorId, Instant.now());
            saveDecision(decided);
            List<ApprovalStep> updatedSteps = steps.stream()
                .map(candidate -> candidate.getId().equals(stepId) ? decided : candidate)
                .toList();

            LeaveStatus newStatus = stateMachine.evaluate(mode, oldStatus, updatedSteps);
            if (newStatus != oldStatus) {
                persistenceService.update(request.advanceTo(newStatus));
                if (!newStatus.isPending()) {
                    stepRepository.closeOpenSteps(requestId, request.getSubmissionRound());
                    settleReservation(request, newStatus);
                }
                leaveMetrics.recordTransition(oldStatus.name(), newStatus.name());
            }

            List<UUID> nextApprovers = approversOf(stateMachine.actionableSteps(mode, newStatus, updatedSteps));
            publishTransition(request, oldStatus, newStatus, actorId, decisionComment, stepId, action, nextApprovers);

            long duration = System.currentTimeMillis() - startTime;
            leaveMetrics.recordLatency("decide_step", duration);
            if (!actorId.equals(step.getApproverId())) {
                log.info("Step {} decided {} by delegate {} on behalf of {}: {} -> {}",
                        stepId, action, actorId, step.getApproverId(), oldStatus, newStatus);
            } else {
                log.info("Step {} decided {} by {}: {} -> {} ({}ms)",
                        stepId, action, actorId, oldStatus, newStatus, duration);
            }
            return new TransitionResult(requestId, oldStatus, newStatus);
        } finally {
            CorrelationContext.clearLeaveContext();
        }
    }

    /**
     * Cancels a non-terminal request on behalf of its owner and releases
     * reserved days if it was pending.
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public TransitionResult cancel(UUID requestId, UUID actorId) {
        LeaveRequest request = persistenceService.lockForUpdate(requestId);
        CorrelationContext.putLeaveContext(requestId, request.getEmployeeId());
        try {
            approvalPolicy.require(actorId, WorkflowAction.CANCEL, request, null);

            LeaveStatus oldStatus = request.getStatus();
            if (oldStatus.isTerminal()) {
                throw new InvalidTransitionException(oldStatus, String.format(
                    "Leave request %s is already %s", requestId, oldStatus));
            }

            persistenceService.update(request.cancel());
            if (oldStatus.isPending()) {
                stepRepository.closeOpenSteps(requestId, request.getSubmissionRound());
                settleReservation(request, LeaveStatus.CANCELLED);
            }

            leaveMetrics.recordTransition(oldStatus.name(), LeaveStatus.CANCELLED.name());
            publishTransition(request, oldStatus, LeaveStatus.CANCELLED, actorId, null, null, null, List.of());

            log.info("Leave request {} cancelled by {}: {} -> CANCELLED", requestId, actorId, oldStatus);
            return new TransitionResult(requestId, oldStatus, LeaveStatus.CANCELLED);
        } finally {
            CorrelationContext.clearLeaveContext();
        }
    }

    /**
     * Steps of the request's current submission round, in step order.
     */
    @Transactional(readOnly = true)
    public List<ApprovalStep> currentRound(LeaveRequest request) {
        return stepRepository.findByLeaveRequestIdAndSubmissionRoundOrderByStepOrderAsc(
                request.getId(), request.getSubmissionRound())
            .stream()
            .map(ApprovalStepEntity::toDomain)
            .toList();
    }

    /**
     * Every step of every submission round, oldest round first.
     */
    @Transactional(readOnly = true)
    public List<ApprovalStep> history(UUID requestId) {
        return stepRepository.findByLeaveRequestIdOrderBySubmissionRoundAscStepOrderAsc(requestId)
            .stream()
            .map(ApprovalStepEntity::toDomain)
            .toList();
    }

    /**
     * Steps that can be decided right now.
     */
    @Transactional(readOnly = true)
    public List<ApprovalStep> actionableSteps(LeaveRequest request) {
        if (!request.getStatus().isPending()) {
            return List.of();
        }
        return stateMachine.actionableSteps(request.getWorkflowMode(), request.getStatus(), currentRound(request));
    }

    /**
     * Leaving the pending state: APPROVED commits the reservation, anything
     * else gives it back. Runs at most once per submission round because the
     * request can leave its pending state only once under the row lock.
     */
    private void settleReservation(LeaveRequest request, LeaveStatus newStatus) {
        if (!request.chargesBalance()) {
            log.debug("Leave request {} does not charge a balance, ledger untouched", request.getId());
            return;
        }
        if (newStatus == LeaveStatus.APPROVED) {
            ledger.commit(request.balanceKey(), request.getTotalDays(), request.getId());
        } else {
            ledger.release(request.balanceKey(), request.getTotalDays(), request.getId());
        }
    }

    private void saveDecision(ApprovalStep decided) {
        ApprovalStepEntity entity = stepRepository.findById(decided.getId())
            .orElseThrow(() -> new IllegalStateException("Approval step vanished: " + decided.getId()));
        entity.updateFromDomain(decided);
        stepRepository.save(entity);
    }

    private void publishTransition(LeaveRequest request, LeaveStatus oldStatus, LeaveStatus newStatus,
                                   UUID actorId, String comment, UUID stepId, ApprovalAction action,
                                   List<UUID> nextApprovers) {
        WorkflowTransitionEvent event = WorkflowTransitionEvent.builder()
            .eventId(UUID.randomUUID())
            .requestId(request.getId())
            .employeeId(request.getEmployeeId())
            .oldStatus(oldStatus)
            .newStatus(newStatus)
            .actorId(actorId)
            .comment(comment)
            .stepId(stepId)
            .action(action)
            .leaveTypeLabel(request.getLeaveTypeLabel())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .nextApproverIds(nextApprovers)
            .occurredAt(Instant.now())
            .build();
        outboxService.saveEvent(event);
    }

    private static List<UUID> approversOf(List<ApprovalStep> steps) {
        return steps.stream().map(ApprovalStep::getApproverId).distinct().toList();
    }
}
