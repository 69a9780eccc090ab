package com.flagship.leave_ledger.workflow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ApprovalStepRepository extends JpaRepository<ApprovalStepEntity, UUID> {

    List<ApprovalStepEntity> findByLeaveRequestIdAndSubmissionRoundOrderByStepOrderAsc(
        UUID leaveRequestId, int submissionRound);

    List<ApprovalStepEntity> findByLeaveRequestIdOrderBySubmissionRoundAscStepOrderAsc(UUID leaveRequestId);

    /**
     * Closes the undecided steps of a round once the request leaves its pending state.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = false)
    @Query("""
        UPDATE ApprovalStepEntity s SET s.closed = true
        WHERE s.leaveRequestId = :leaveRequestId AND s.submissionRound = :round AND s.action IS NULL
        """)
    int closeOpenSteps(@Param("leaveRequestId") UUID leaveRequestId, @Param("round") int round);

    /**
     * Open steps assigned to any of the given approvers, on requests still pending.
     */
    @Query(value = """
        SELECT s.* FROM approval_steps s
        JOIN leave_requests r ON r.id = s.leave_request_id AND r.submission_round = s.submission_round
        WHERE s.approver_id IN (:approverIds)
          AND s.action IS NULL AND NOT s.closed
          AND r.status IN ('PENDING_MANAGER', 'PENDING_HR')
        ORDER BY r.submitted_at ASC, s.step_order ASC
        """, nativeQuery = true)
    List<ApprovalStepEntity> findOpenStepsForApprovers(@Param("approverIds") Collection<UUID> approverIds);
}
