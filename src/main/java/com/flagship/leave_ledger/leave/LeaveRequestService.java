package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.balance.LeaveBalance;
import com.flagship.leave_ledger.balance.LeaveBalanceLedger;
import com.flagship.leave_ledger.calendar.HalfDay;
import com.flagship.leave_ledger.calendar.InvalidRangeException;
import com.flagship.leave_ledger.calendar.WorkingDayCalculator;
import com.flagship.leave_ledger.directory.EmployeeProfile;
import com.flagship.leave_ledger.directory.OfficePolicy;
import com.flagship.leave_ledger.directory.OrganizationDirectory;
import com.flagship.leave_ledger.exception.InsufficientBalanceException;
import com.flagship.leave_ledger.exception.InvalidTransitionException;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import com.flagship.leave_ledger.exception.OverlapConflictException;
import com.flagship.leave_ledger.observability.CorrelationContext;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import com.flagship.leave_ledger.workflow.ApprovalPolicy;
import com.flagship.leave_ledger.workflow.ApprovalWorkflowEngine;
import com.flagship.leave_ledger.workflow.TransitionResult;
import com.flagship.leave_ledger.workflow.WorkflowAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Leave intake: creation, revision and (re)submission of leave requests.
 *
 * Intake rules, checked in this order:
 * 1. Dates present, end not before start, no AFTERNOON-to-MORNING single day
 * 2. Employee active, leave type active and offered by the employee's office
 * 3. Employee past the office's probation period
 * 4. At least one working day in the range
 * 5. No overlap with a live request of the same employee (409)
 * 6. Attachment present when the type requires one for this length (on submission)
 * 7. Enough remaining balance (reserved on submission, checked for drafts)
 *
 * Intake for one employee is serialized with a transaction-scoped advisory
 * lock, so two concurrent overlapping requests cannot both pass rule 5.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveRequestService {

    private final LeaveRequestPersistenceService persistenceService;
    private final OrganizationDirectory organizationDirectory;
    private final WorkingDayCalculator workingDayCalculator;
    private final LeaveBalanceLedger ledger;
    private final ApprovalPolicy approvalPolicy;
    private final ApprovalWorkflowEngine workflowEngine;
    private final LeaveMetrics leaveMetrics;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Creates a request, as a draft or submitted straight away.
     *
     * @param idempotencyKey stored with the request; may be null. A key that an
     *        earlier call already stored replays that call's request.
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public IntakeResult create(LeaveRequestCommand command, UUID actorId, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String leaveTypeTag = "unknown";
        try {
            validateRange(command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault());
            if (command.getEmployeeId() == null || command.getLeaveTypeId() == null) {
                throw new LeaveValidationException("Employee and leave type are required");
            }

            lockEmployeeIntake(command.getEmployeeId());
            if (idempotencyKey != null) {
                Optional<UUID> existingId = persistenceService.findIdByIdempotencyKey(idempotencyKey);
                if (existingId.isPresent()) {
                    log.info("Idempotency key {} is already stored, replaying leave request {}",
                            idempotencyKey, existingId.get());
                    return IntakeResult.replayed(persistenceService.getById(existingId.get()));
                }
            }
            EmployeeProfile employee = requireEmployee(command.getEmployeeId());
            LeaveTypeConfig leaveType = requireLeaveType(command.getLeaveTypeId(), employee);
            leaveTypeTag = leaveType.getCode();
            OfficePolicy office = requireOffice(employee);

            if (office.isOnProbation(employee.getHireDate(), LocalDate.now())) {
                throw new LeaveValidationException("Leave requests are not possible during the probation period");
            }

            BigDecimal totalDays = countWorkingDays(office, command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault());

            LeaveRequest draft = LeaveRequest.draft(employee.getId(), leaveType,
                    command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault(),
                    totalDays, blankToNull(command.getReason()), blankToNull(command.getExceptionalReason()),
                    command.getAttachmentUrls());
            approvalPolicy.require(actorId, WorkflowAction.CREATE, draft, null);
            CorrelationContext.putLeaveContext(draft.getId(), draft.getEmployeeId());

            requireNoOverlap(draft);
            if (command.isAsDraft()) {
                requireAvailableBalance(draft);
            } else {
                requireAttachments(leaveType, draft);
            }

            LeaveRequest saved = persistenceService.save(draft, idempotencyKey);
            if (!command.isAsDraft()) {
                workflowEngine.startRound(saved, employee, actorId);
                saved = persistenceService.getById(saved.getId());
            }

            long duration = System.currentTimeMillis() - startTime;
            leaveMetrics.recordRequestCreated(leaveTypeTag, command.isAsDraft() ? "draft" : "submitted");
            leaveMetrics.recordLatency("create", duration);
            log.info("Leave request created: type={}, {}..{}, days={}, status={}, duration={}ms",
                    leaveType.getCode(), saved.getStartDate(), saved.getEndDate(),
                    saved.getTotalDays(), saved.getStatus(), duration);
            return IntakeResult.created(saved);

        } catch (RuntimeException e) {
            leaveMetrics.recordRequestCreated(leaveTypeTag, "rejected");
            leaveMetrics.recordLatency("create", System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            CorrelationContext.clearLeaveContext();
        }
    }

    /**
     * Submits a DRAFT, or resubmits a RETURNED request as a new round.
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public TransitionResult submit(UUID requestId, UUID actorId) {
        LeaveRequest request = persistenceService.lockForUpdate(requestId);
        CorrelationContext.putLeaveContext(requestId, request.getEmployeeId());
        try {
            approvalPolicy.require(actorId, WorkflowAction.SUBMIT, request, null);
            if (!request.getStatus().isEditable()) {
                throw new InvalidTransitionException(request.getStatus(), String.format(
                    "Leave request %s cannot be submitted in %s status", requestId, request.getStatus()));
            }

            EmployeeProfile employee = requireEmployee(request.getEmployeeId());
            LeaveTypeConfig leaveType = requireLeaveType(request.getLeaveTypeId(), employee);
            requireAttachments(leaveType, request);

            return workflowEngine.startRound(request, employee, actorId);
        } finally {
            CorrelationContext.clearLeaveContext();
        }
    }

    /**
     * Edits the dates, reason or attachments of a DRAFT or RETURNED request.
     * No balance is held in these states, so nothing moves on the ledger.
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public LeaveRequest revise(UUID requestId, UUID actorId, LeaveRequestCommand command) {
        LeaveRequest request = persistenceService.lockForUpdate(requestId);
        CorrelationContext.putLeaveContext(requestId, request.getEmployeeId());
        try {
            approvalPolicy.require(actorId, WorkflowAction.REVISE, request, null);
            if (!request.getStatus().isEditable()) {
                throw new InvalidTransitionException(request.getStatus(), String.format(
                    "Leave request %s cannot be revised in %s status", requestId, request.getStatus()));
            }
            validateRange(command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault());

            lockEmployeeIntake(request.getEmployeeId());
            EmployeeProfile employee = requireEmployee(request.getEmployeeId());
            OfficePolicy office = requireOffice(employee);
            BigDecimal totalDays = countWorkingDays(office, command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault());

            LeaveRequest revised = request.revise(command.getStartDate(), command.getEndDate(),
                    command.startHalfDayOrDefault(), command.endHalfDayOrDefault(),
                    totalDays, blankToNull(command.getReason()), command.getAttachmentUrls());
            requireNoOverlap(revised);

            LeaveRequest saved = persistenceService.update(revised);
            log.info("Leave request {} revised: {}..{}, days={}",
                    requestId, saved.getStartDate(), saved.getEndDate(), saved.getTotalDays());
            return saved;
        } finally {
            CorrelationContext.clearLeaveContext();
        }
    }

    /**
     * Working days the range would cost the employee, without side effects.
     */
    @Transactional(readOnly = true)
    public WorkingDaysPreview preview(UUID employeeId, LocalDate start, LocalDate end,
                                      HalfDay startHalfDay, HalfDay endHalfDay) {
        HalfDay startMarker = startHalfDay != null ? startHalfDay : HalfDay.FULL_DAY;
        HalfDay endMarker = endHalfDay != null ? endHalfDay : HalfDay.FULL_DAY;
        validateRange(start, end, startMarker, endMarker);

        EmployeeProfile employee = requireEmployee(employeeId);
        OfficePolicy office = requireOffice(employee);
        Set<LocalDate> holidays = organizationDirectory.holidays(office.getId(), start, end);
        BigDecimal totalDays = workingDayCalculator.compute(start, end, startMarker, endMarker,
                office.getWorkingWeek(), holidays);
        return new WorkingDaysPreview(totalDays, holidays);
    }

    @Transactional(readOnly = true)
    public LeaveRequest get(UUID requestId) {
        return persistenceService.getById(requestId);
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> listForEmployee(UUID employeeId) {
        return persistenceService.findByEmployee(employeeId);
    }

    private void validateRange(LocalDate start, LocalDate end, HalfDay startHalfDay, HalfDay endHalfDay) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Start and end dates are required");
        }
        if (end.isBefore(start)) {
            throw new InvalidRangeException(String.format("End date %s is before start date %s", end, start));
        }
        if (start.equals(end) && startHalfDay == HalfDay.AFTERNOON && endHalfDay == HalfDay.MORNING) {
            throw new InvalidRangeException("A single day cannot start in the afternoon and end in the morning");
        }
    }

    private BigDecimal countWorkingDays(OfficePolicy office, LocalDate start, LocalDate end,
                                        HalfDay startHalfDay, HalfDay endHalfDay) {
        Set<LocalDate> holidays = organizationDirectory.holidays(office.getId(), start, end);
        BigDecimal totalDays = workingDayCalculator.compute(start, end, startHalfDay, endHalfDay,
                office.getWorkingWeek(), holidays);
        if (totalDays.signum() <= 0) {
            throw new LeaveValidationException("The selected period contains no working day");
        }
        return totalDays;
    }

    private void requireNoOverlap(LeaveRequest request) {
        List<LeaveRequest> overlapping = persistenceService.findOverlapping(
                request.getEmployeeId(), request.getStartDate(), request.getEndDate(), request.getId());
        if (!overlapping.isEmpty()) {
            LeaveRequest existing = overlapping.get(0);
            throw new OverlapConflictException(existing.getId());
        }
    }

    private void requireAttachments(LeaveTypeConfig leaveType, LeaveRequest request) {
        boolean hasAttachment = request.getAttachmentUrls() != null && !request.getAttachmentUrls().isEmpty();
        if (!hasAttachment && leaveType.requiresAttachmentFor(request.getTotalDays())) {
            throw new LeaveValidationException(String.format(
                "Leave type %s requires a supporting document for %s day(s)",
                leaveType.getCode(), request.getTotalDays()));
        }
    }

    /**
     * Read-only check for drafts. Submission reserves atomically in the ledger instead.
     */
    private void requireAvailableBalance(LeaveRequest request) {
        if (!request.chargesBalance()) {
            return;
        }
        BigDecimal remaining = ledger.find(request.balanceKey())
            .map(LeaveBalance::remaining)
            .orElse(BigDecimal.ZERO);
        if (remaining.compareTo(request.getTotalDays()) < 0) {
            throw new InsufficientBalanceException(request.balanceKey(), remaining, request.getTotalDays());
        }
    }

    private EmployeeProfile requireEmployee(UUID employeeId) {
        EmployeeProfile employee = organizationDirectory.findEmployee(employeeId)
            .orElseThrow(() -> new LeaveValidationException("Unknown employee: " + employeeId));
        if (!employee.isActive()) {
            throw new LeaveValidationException("Employee " + employeeId + " is not active");
        }
        return employee;
    }

    private LeaveTypeConfig requireLeaveType(UUID leaveTypeId, EmployeeProfile employee) {
        LeaveTypeConfig leaveType = organizationDirectory.findLeaveType(leaveTypeId)
            .orElseThrow(() -> new LeaveValidationException("Unknown leave type: " + leaveTypeId));
        if (!leaveType.isActive() || !leaveType.getOfficeId().equals(employee.getOfficeId())) {
            throw new LeaveValidationException("Leave type " + leaveType.getCode() + " is not available to this employee");
        }
        return leaveType;
    }

    private OfficePolicy requireOffice(EmployeeProfile employee) {
        return organizationDirectory.findOfficePolicy(employee.getOfficeId())
            .orElseThrow(() -> new IllegalStateException("Office not found: " + employee.getOfficeId()));
    }

    /**
     * Transaction-scoped advisory lock keyed by employee, released at commit or rollback.
     */
    private void lockEmployeeIntake(UUID employeeId) {
        long lockKey = employeeId.getMostSignificantBits() ^ employeeId.getLeastSignificantBits();
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> null, lockKey);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
