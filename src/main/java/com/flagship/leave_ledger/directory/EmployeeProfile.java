package com.flagship.leave_ledger.directory;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * What the leave core needs to know about an employee. managerId is the
 * manager of the employee's team, null when the employee has no team.
 */
@Value
public class EmployeeProfile {
    UUID id;
    UUID officeId;
    UUID teamId;
    UUID managerId;
    String fullName;
    String email;
    LocalDate hireDate;
    boolean hr;
    boolean active;
}
