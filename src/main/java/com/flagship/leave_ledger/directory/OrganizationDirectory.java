package com.flagship.leave_ledger.directory;

import com.flagship.leave_ledger.leave.LeaveTypeConfig;
import com.flagship.leave_ledger.workflow.WorkflowConfig;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of the organization: employees, offices, holidays, leave
 * types and workflow configuration. Maintained elsewhere; the leave core
 * never writes to it.
 */
public interface OrganizationDirectory {

    Optional<EmployeeProfile> findEmployee(UUID employeeId);

    Optional<OfficePolicy> findOfficePolicy(UUID officeId);

    /**
     * Public holidays of the office between from and to, both inclusive.
     */
    Set<LocalDate> holidays(UUID officeId, LocalDate from, LocalDate to);

    /**
     * Active HR employees of the office, in a stable order.
     */
    List<UUID> hrApprovers(UUID officeId);

    Optional<LeaveTypeConfig> findLeaveType(UUID leaveTypeId);

    /**
     * The active workflow of the team if it overrides its office, otherwise the office's.
     */
    Optional<WorkflowConfig> findWorkflow(UUID officeId, UUID teamId);
}
