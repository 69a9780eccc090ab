package com.flagship.leave_ledger.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for approval steps. No setters: a step changes only through
 * {@link #updateFromDomain(ApprovalStep)} with a decision taken by the domain object.
 */
@Entity
@Table(name = "approval_steps")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalStepEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "leave_request_id", nullable = false, updatable = false)
    private UUID leaveRequestId;

    @Column(name = "submission_round", nullable = false, updatable = false)
    private int submissionRound;

    @Column(name = "step_order", nullable = false, updatable = false)
    private int stepOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false, updatable = false)
    private StepType stepType;

    @Column(name = "approver_id", nullable = false, updatable = false)
    private UUID approverId;

    @Column(name = "decided_by")
    private UUID decidedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "action")
    private ApprovalAction action;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "closed", nullable = false)
    private boolean closed;

    static ApprovalStepEntity fromDomain(ApprovalStep step) {
        return new ApprovalStepEntity(
            step.getId(),
            step.getLeaveRequestId(),
            step.getSubmissionRound(),
            step.getStepOrder(),
            step.getStepType(),
            step.getApproverId(),
            step.getDecidedBy(),
            step.getAction(),
            step.getComment(),
            step.getDecidedAt(),
            step.isClosed()
        );
    }

    public ApprovalStep toDomain() {
        return new ApprovalStep(
            id,
            leaveRequestId,
            submissionRound,
            stepOrder,
            stepType,
            approverId,
            decidedBy,
            action,
            comment,
            decidedAt,
            closed
        );
    }

    /**
     * Only the decision fields change; a decision is never overwritten.
     */
    void updateFromDomain(ApprovalStep step) {
        if (this.action != null && this.action != step.getAction()) {
            throw new IllegalStateException("Step " + id + " was already decided");
        }
        this.decidedBy = step.getDecidedBy();
        this.action = step.getAction();
        this.comment = step.getComment();
        this.decidedAt = step.getDecidedAt();
        this.closed = step.isClosed();
    }
}
