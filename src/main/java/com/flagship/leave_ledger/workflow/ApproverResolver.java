package com.flagship.leave_ledger.workflow;

import com.flagship.leave_ledger.directory.EmployeeProfile;
import com.flagship.leave_ledger.directory.OrganizationDirectory;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns configured workflow steps into concrete approval steps for one
 * submission round.
 *
 * A pinned approver wins. Otherwise MANAGER steps go to the manager of the
 * employee's team and HR steps to the office's HR employees, spread across
 * them in order when the workflow has several HR steps. The requester is
 * never assigned their own request.
 */
@Component
@RequiredArgsConstructor
public class ApproverResolver {

    private final OrganizationDirectory organizationDirectory;

    public List<ApprovalStep> materialize(UUID leaveRequestId, int submissionRound,
                                          EmployeeProfile employee, List<WorkflowStepDefinition> definitions) {
        List<UUID> hrApprovers = null;
        int hrIndex = 0;
        List<ApprovalStep> steps = new ArrayList<>();

        for (WorkflowStepDefinition definition : definitions) {
            UUID approverId = definition.getApproverId();
            if (approverId == null) {
                if (definition.getStepType() == StepType.MANAGER) {
                    approverId = managerOf(employee);
                } else {
                    if (hrApprovers == null) {
                        hrApprovers = organizationDirectory.hrApprovers(employee.getOfficeId())
                            .stream()
                            .filter(id -> !id.equals(employee.getId()))
                            .toList();
                    }
                    if (hrApprovers.isEmpty()) {
                        throw new LeaveValidationException(
                            "No HR approver is available for office " + employee.getOfficeId());
                    }
                    approverId = hrApprovers.get(hrIndex++ % hrApprovers.size());
                }
            }
            if (approverId.equals(employee.getId())) {
                throw new LeaveValidationException(
                    "Employee " + employee.getId() + " cannot approve their own leave request");
            }
            steps.add(ApprovalStep.open(leaveRequestId, submissionRound, definition.getStepOrder(),
                    definition.getStepType(), approverId));
        }
        return steps;
    }

    private UUID managerOf(EmployeeProfile employee) {
        UUID managerId = employee.getManagerId();
        if (managerId == null) {
            throw new LeaveValidationException(
                "Employee " + employee.getId() + " has no team manager to approve the request");
        }
        return managerId;
    }
}
