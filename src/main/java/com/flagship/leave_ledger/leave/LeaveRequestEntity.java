package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.calendar.HalfDay;
import com.flagship.leave_ledger.workflow.LeaveStatus;
import com.flagship.leave_ledger.workflow.WorkflowMode;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for leave requests.
 *
 * - No setters: state changes go through {@link #updateFromDomain(LeaveRequest)}
 * - Identity, employee, leave type and ledger touch are not updatable
 * - @Version guards against lost updates on top of the row lock taken by workflow commands
 * - The idempotency key is a persistence concern and is passed in separately
 */
@Entity
@Table(
    name = "leave_requests",
    indexes = {
        @Index(name = "idx_leave_requests_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LeaveRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "leave_type_id", nullable = false, updatable = false)
    private UUID leaveTypeId;

    @Column(name = "leave_type_code", nullable = false, updatable = false)
    private String leaveTypeCode;

    @Column(name = "leave_type_label", nullable = false, updatable = false)
    private String leaveTypeLabel;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_type", updatable = false)
    private BalanceType balanceType;

    @Column(name = "balance_year", nullable = false)
    private int balanceYear;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "start_half_day", nullable = false)
    private HalfDay startHalfDay;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_half_day", nullable = false)
    private HalfDay endHalfDay;

    @Column(name = "total_days", nullable = false, precision = 6, scale = 1)
    private BigDecimal totalDays;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LeaveStatus status;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "exceptional_reason", columnDefinition = "TEXT")
    private String exceptionalReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "leave_request_attachments", joinColumns = @JoinColumn(name = "leave_request_id"))
    @Column(name = "attachment_url", nullable = false)
    private List<String> attachmentUrls = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "workflow_mode")
    private WorkflowMode workflowMode;

    @Column(name = "submission_round", nullable = false)
    private int submissionRound;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "last_reminder_sent_at")
    private Instant lastReminderSentAt;

    // Wrapper type: a null version marks a new entity for Spring Data
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LeaveRequestEntity fromDomain(LeaveRequest request, String idempotencyKey) {
        LeaveRequestEntity entity = new LeaveRequestEntity();
        entity.id = request.getId();
        entity.employeeId = request.getEmployeeId();
        entity.leaveTypeId = request.getLeaveTypeId();
        entity.leaveTypeCode = request.getLeaveTypeCode();
        entity.leaveTypeLabel = request.getLeaveTypeLabel();
        entity.balanceType = request.getBalanceType();
        entity.idempotencyKey = idempotencyKey;
        entity.updateFromDomain(request);
        return entity;
    }

    public LeaveRequest toDomain() {
        return LeaveRequest.builder()
            .id(id)
            .employeeId(employeeId)
            .leaveTypeId(leaveTypeId)
            .leaveTypeCode(leaveTypeCode)
            .leaveTypeLabel(leaveTypeLabel)
            .balanceType(balanceType)
            .balanceYear(balanceYear)
            .startDate(startDate)
            .endDate(endDate)
            .startHalfDay(startHalfDay)
            .endHalfDay(endHalfDay)
            .totalDays(totalDays)
            .status(status)
            .reason(reason)
            .exceptionalReason(exceptionalReason)
            .attachmentUrls(List.copyOf(attachmentUrls))
            .workflowMode(workflowMode)
            .submissionRound(submissionRound)
            .submittedAt(submittedAt)
            .lastReminderSentAt(lastReminderSentAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of the domain object. Timestamps are handled by the lifecycle hooks.
     */
    void updateFromDomain(LeaveRequest request) {
        this.balanceYear = request.getBalanceYear();
        this.startDate = request.getStartDate();
        this.endDate = request.getEndDate();
        this.startHalfDay = request.getStartHalfDay();
        this.endHalfDay = request.getEndHalfDay();
        this.totalDays = request.getTotalDays();
        this.status = request.getStatus();
        this.reason = request.getReason();
        this.exceptionalReason = request.getExceptionalReason();
        this.workflowMode = request.getWorkflowMode();
        this.submissionRound = request.getSubmissionRound();
        this.submittedAt = request.getSubmittedAt();
        this.lastReminderSentAt = request.getLastReminderSentAt();
        if (!this.attachmentUrls.equals(request.getAttachmentUrls())) {
            this.attachmentUrls.clear();
            this.attachmentUrls.addAll(request.getAttachmentUrls());
        }
    }
}
