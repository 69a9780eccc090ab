package com.flagship.leave_ledger.directory;

import com.flagship.leave_ledger.balance.BalanceType;
import com.flagship.leave_ledger.calendar.WorkingWeek;
import com.flagship.leave_ledger.leave.LeaveTypeConfig;
import com.flagship.leave_ledger.workflow.StepType;
import com.flagship.leave_ledger.workflow.WorkflowConfig;
import com.flagship.leave_ledger.workflow.WorkflowMode;
import com.flagship.leave_ledger.workflow.WorkflowStepDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link OrganizationDirectory} over the reference tables of the shared database.
 */
@Repository
@RequiredArgsConstructor
public class JdbcOrganizationDirectory implements OrganizationDirectory {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<EmployeeProfile> findEmployee(UUID employeeId) {
        return jdbcTemplate.query("""
            SELECT e.id, e.office_id, e.team_id, t.manager_id, e.full_name, e.email,
                   e.hire_date, e.is_hr, e.is_active
            FROM employees e
            LEFT JOIN teams t ON t.id = e.team_id
            WHERE e.id = ?
            """,
            (rs, rowNum) -> new EmployeeProfile(
                rs.getObject("id", UUID.class),
                rs.getObject("office_id", UUID.class),
                rs.getObject("team_id", UUID.class),
                rs.getObject("manager_id", UUID.class),
                rs.getString("full_name"),
                rs.getString("email"),
                toLocalDate(rs.getDate("hire_date")),
                rs.getBoolean("is_hr"),
                rs.getBoolean("is_active")
            ),
            employeeId
        ).stream().findFirst();
    }

    @Override
    public Optional<OfficePolicy> findOfficePolicy(UUID officeId) {
        return jdbcTemplate.query("""
            SELECT id, working_days, default_annual_leave, default_offered_days,
                   max_carry_over_days, probation_months
            FROM offices WHERE id = ?
            """,
            (rs, rowNum) -> new OfficePolicy(
                rs.getObject("id", UUID.class),
                WorkingWeek.parse(rs.getString("working_days")),
                rs.getBigDecimal("default_annual_leave"),
                rs.getBigDecimal("default_offered_days"),
                rs.getBigDecimal("max_carry_over_days"),
                rs.getInt("probation_months")
            ),
            officeId
        ).stream().findFirst();
    }

    @Override
    public Set<LocalDate> holidays(UUID officeId, LocalDate from, LocalDate to) {
        List<LocalDate> dates = jdbcTemplate.query(
            "SELECT holiday_date FROM public_holidays WHERE office_id = ? AND holiday_date BETWEEN ? AND ?",
            (rs, rowNum) -> rs.getDate("holiday_date").toLocalDate(),
            officeId, Date.valueOf(from), Date.valueOf(to)
        );
        return new HashSet<>(dates);
    }

    @Override
    public List<UUID> hrApprovers(UUID officeId) {
        return jdbcTemplate.query(
            "SELECT id FROM employees WHERE office_id = ? AND is_hr AND is_active ORDER BY full_name, id",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            officeId
        );
    }

    @Override
    public Optional<LeaveTypeConfig> findLeaveType(UUID leaveTypeId) {
        return jdbcTemplate.query("""
            SELECT id, office_id, code, label_fr, label_en, deducts_from_balance, balance_type,
                   balance_exempt, requires_attachment, attachment_from_day, color, is_active
            FROM leave_type_configs WHERE id = ?
            """,
            (rs, rowNum) -> {
                String balanceType = rs.getString("balance_type");
                return new LeaveTypeConfig(
                    rs.getObject("id", UUID.class),
                    rs.getObject("office_id", UUID.class),
                    rs.getString("code"),
                    rs.getString("label_fr"),
                    rs.getString("label_en"),
                    rs.getBoolean("deducts_from_balance"),
                    balanceType != null ? BalanceType.valueOf(balanceType) : null,
                    rs.getBoolean("balance_exempt"),
                    rs.getBoolean("requires_attachment"),
                    rs.getBigDecimal("attachment_from_day"),
                    rs.getString("color"),
                    rs.getBoolean("is_active")
                );
            },
            leaveTypeId
        ).stream().findFirst();
    }

    @Override
    public Optional<WorkflowConfig> findWorkflow(UUID officeId, UUID teamId) {
        // Team override first, then the office-wide workflow
        List<WorkflowHeader> headers = jdbcTemplate.query("""
            SELECT id, mode FROM workflow_configs
            WHERE office_id = ? AND is_active AND (team_id = ? OR team_id IS NULL)
            ORDER BY CASE WHEN team_id IS NULL THEN 1 ELSE 0 END
            LIMIT 1
            """,
            (rs, rowNum) -> new WorkflowHeader(
                rs.getObject("id", UUID.class),
                WorkflowMode.valueOf(rs.getString("mode"))
            ),
            officeId, teamId
        );
        if (headers.isEmpty()) {
            return Optional.empty();
        }

        WorkflowHeader header = headers.get(0);
        List<WorkflowStepDefinition> steps = jdbcTemplate.query(
            "SELECT step_order, step_type, is_required, approver_id FROM workflow_steps " +
            "WHERE workflow_config_id = ? ORDER BY step_order",
            (rs, rowNum) -> new WorkflowStepDefinition(
                rs.getInt("step_order"),
                StepType.valueOf(rs.getString("step_type")),
                rs.getBoolean("is_required"),
                rs.getObject("approver_id", UUID.class)
            ),
            header.id()
        );
        return Optional.of(new WorkflowConfig(header.id(), header.mode(), steps));
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }

    private record WorkflowHeader(UUID id, WorkflowMode mode) {
    }
}
