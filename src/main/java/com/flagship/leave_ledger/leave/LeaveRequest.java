package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.balance.BalanceKey;
import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.calendar.HalfDay;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import com.flagship.leave_ledger.workflow.WorkflowMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Leave request domain object.
 *
 * The ledger touch is fixed at creation: balanceType is null when the leave
 * type does not charge a balance, and balanceYear is the year of the start
 * date. Later edits to the leave type never change how an existing request
 * affects balances.
 *
 * State changes are immutable (each transition returns a new instance) and
 * invalid transitions throw {@link IllegalStateException}.
 */
@Value
@Builder(toBuilder = true)
public class LeaveRequest {
    UUID id;
    UUID employeeId;
    UUID leaveTypeId;
    String leaveTypeCode;
    String leaveTypeLabel;
    BalanceType balanceType;
    int balanceYear;
    LocalDate startDate;
    LocalDate endDate;
    HalfDay startHalfDay;
    HalfDay endHalfDay;
    BigDecimal totalDays;
    LeaveStatus status;
    String reason;
    String exceptionalReason;
    List<String> attachmentUrls;
    WorkflowMode workflowMode;
    int submissionRound;
    Instant submittedAt;
    Instant lastReminderSentAt;
    Instant createdAt;
    Instant updatedAt;

    public static LeaveRequest draft(UUID employeeId, LeaveTypeConfig leaveType,
                                     LocalDate startDate, LocalDate endDate,
                                     HalfDay startHalfDay, HalfDay endHalfDay,
                                     BigDecimal totalDays, String reason, String exceptionalReason,
                                     List<String> attachmentUrls) {
        Instant now = Instant.now();
        return LeaveRequest.builder()
            .id(UUID.randomUUID())
            .employeeId(employeeId)
            .leaveTypeId(leaveType.getId())
            .leaveTypeCode(leaveType.getCode())
            .leaveTypeLabel(leaveType.getLabelEn())
            .balanceType(leaveType.chargesBalance() ? leaveType.getBalanceType() : null)
            .balanceYear(startDate.getYear())
            .startDate(startDate)
            .endDate(endDate)
            .startHalfDay(startHalfDay)
            .endHalfDay(endHalfDay)
            .totalDays(totalDays)
            .status(LeaveStatus.DRAFT)
            .reason(reason)
            .exceptionalReason(exceptionalReason)
            .attachmentUrls(attachmentUrls != null ? List.copyOf(attachmentUrls) : List.of())
            .submissionRound(0)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean chargesBalance() {
        return balanceType != null;
    }

    public BalanceKey balanceKey() {
        if (!chargesBalance()) {
            throw new IllegalStateException("Leave request " + id + " does not charge a balance");
        }
        return BalanceKey.of(employeeId, balanceYear, balanceType);
    }

    /**
     * Starts a new submission round.
     *
     * @param initialStatus first pending stage, or APPROVED for a workflow without steps
     */
    public LeaveRequest submit(WorkflowMode mode, LeaveStatus initialStatus) {
        if (!status.isEditable()) {
            throw new IllegalStateException(String.format(
                "Cannot submit leave request in %s status. Only DRAFT or RETURNED requests can be submitted.",
                status));
        }
        if (!initialStatus.isPending() && initialStatus != LeaveStatus.APPROVED) {
            throw new IllegalArgumentException("Invalid initial status: " + initialStatus);
        }
        return toBuilder()
            .status(initialStatus)
            .workflowMode(mode)
            .submissionRound(submissionRound + 1)
            .submittedAt(Instant.now())
            .lastReminderSentAt(null)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Moves a pending request to the status computed from its steps.
     */
    public LeaveRequest advanceTo(LeaveStatus newStatus) {
        if (!status.isPending()) {
            throw new IllegalStateException(String.format(
                "Cannot move leave request from %s. Only pending requests are decided.", status));
        }
        if (newStatus == LeaveStatus.DRAFT || newStatus == LeaveStatus.CANCELLED) {
            throw new IllegalStateException("A decision cannot move a request to " + newStatus);
        }
        return toBuilder().status(newStatus).updatedAt(Instant.now()).build();
    }

    public LeaveRequest cancel() {
        if (status.isTerminal()) {
            throw new IllegalStateException(String.format(
                "Cannot cancel leave request in %s status.", status));
        }
        return toBuilder().status(LeaveStatus.CANCELLED).updatedAt(Instant.now()).build();
    }

    public LeaveRequest revise(LocalDate newStart, LocalDate newEnd, HalfDay newStartHalf, HalfDay newEndHalf,
                               BigDecimal newTotalDays, String newReason, List<String> newAttachments) {
        if (!status.isEditable()) {
            throw new IllegalStateException(String.format(
                "Cannot revise leave request in %s status. Only DRAFT or RETURNED requests can be revised.",
                status));
        }
        return toBuilder()
            .startDate(newStart)
            .endDate(newEnd)
            .startHalfDay(newStartHalf)
            .endHalfDay(newEndHalf)
            .totalDays(newTotalDays)
            .balanceYear(newStart.getYear())
            .reason(newReason)
            .attachmentUrls(newAttachments != null ? List.copyOf(newAttachments) : attachmentUrls)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Whether days are currently held as pending on the balance.
     */
    public boolean holdsReservation() {
        return chargesBalance() && status.isPending();
    }
}
