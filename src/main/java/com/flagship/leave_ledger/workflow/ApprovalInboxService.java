package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.directory.DelegationDirectory;
import com.flagship.leave_ledger.leave.LeaveRequest;
import com.flagship.leave_ledger.leave.LeaveRequestPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Steps an approver can decide right now, including those of approvers who
 * delegated to them today.
 */
@Service
@RequiredArgsConstructor
public class ApprovalInboxService {

    private final ApprovalStepRepository stepRepository;
    private final LeaveRequestPersistenceService persistenceService;
    private final DelegationDirectory delegationDirectory;
    private final WorkflowStateMachine stateMachine;

    @Transactional(readOnly = true)
    public List<PendingApproval> actionableFor(UUID actorId) {
        Set<UUID> approverIds = new HashSet<>(delegationDirectory.delegatorsOf(actorId, LocalDate.now()));
        approverIds.add(actorId);

        Map<UUID, Optional<LeaveRequest>> requests = new HashMap<>();
        Map<UUID, List<ApprovalStep>> rounds = new HashMap<>();
        List<PendingApproval> pending = new ArrayList<>();

        for (ApprovalStepEntity entity : stepRepository.findOpenStepsForApprovers(approverIds)) {
            ApprovalStep step = entity.toDomain();
            Optional<LeaveRequest> request = requests.computeIfAbsent(
                step.getLeaveRequestId(), persistenceService::findById);
            if (request.isEmpty() || actorId.equals(request.get().getEmployeeId())) {
                continue;
            }
            LeaveRequest leave = request.get();
            List<ApprovalStep> round = rounds.computeIfAbsent(leave.getId(), id ->
                stepRepository.findByLeaveRequestIdAndSubmissionRoundOrderByStepOrderAsc(id, leave.getSubmissionRound())
                    .stream()
                    .map(ApprovalStepEntity::toDomain)
                    .toList());
            if (stateMachine.isActionable(leave.getWorkflowMode(), leave.getStatus(), round, step)) {
                pending.add(new PendingApproval(step, leave, !actorId.equals(step.getApproverId())));
            }
        }
        return pending;
    }

    @Value
    public static class PendingApproval {
        ApprovalStep step;
        LeaveRequest request;
        boolean delegated;
    }
}
