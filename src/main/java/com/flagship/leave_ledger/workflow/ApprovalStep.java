package com.flagship.leave_ledger.workflow;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One approval step of one submission round of a leave request.
 *
 * A step is decided at most once. A second decision is rejected rather than
 * overwriting the first. decidedBy differs from approverId when a delegate
 * decided on the approver's behalf.
 */
@Value
public class ApprovalStep {
    UUID id;
    UUID leaveRequestId;
    int submissionRound;
    int stepOrder;
    StepType stepType;
    UUID approverId;
    UUID decidedBy;
    ApprovalAction action;
    String comment;
    Instant decidedAt;
    boolean closed;

    public static ApprovalStep open(UUID leaveRequestId, int submissionRound, int stepOrder,
                                    StepType stepType, UUID approverId) {
        return new ApprovalStep(
            UUID.randomUUID(),
            leaveRequestId,
            submissionRound,
            stepOrder,
            stepType,
            approverId,
            null,
            null,
            null,
            null,
            false
        );
    }

    public boolean isDecided() {
        return action != null;
    }

    /**
     * Records the decision.
     *
     * @throws IllegalStateException if the step was already decided or its round is closed
     */
    public ApprovalStep decide(ApprovalAction decision, String decisionComment, UUID decider, Instant at) {
        if (isDecided()) {
            throw new IllegalStateException(
                String.format("Step %s was already decided (%s)", id, action));
        }
        if (closed) {
            throw new IllegalStateException(
                String.format("Step %s belongs to a closed submission round", id));
        }
        return new ApprovalStep(
            id,
            leaveRequestId,
            submissionRound,
            stepOrder,
            stepType,
            approverId,
            decider,
            decision,
            decisionComment,
            at,
            false
        );
    }
}
