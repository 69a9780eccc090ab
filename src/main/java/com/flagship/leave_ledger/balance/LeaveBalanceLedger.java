package com.flagship.leave_ledger.balance;

import com.flagship.leave_ledger.event.BalanceMutationEvent;
import com.flagship.leave_ledger.exception.BalanceNotFoundException;
import com.flagship.leave_ledger.exception.InsufficientBalanceException;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import com.flagship.leave_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-employee, per-year, per-balance-type leave accounts.
 *
 * Invariant: total + carriedOver - used - pending >= 0 after every mutation.
 *
 * Every mutation is a single guarded UPDATE: the invariant is part of the
 * WHERE clause, so two concurrent reservations against a nearly exhausted
 * balance cannot both succeed. A zero row count means the guard failed and
 * nothing was written. The table's CHECK constraints are the last line of
 * defence if a statement here is ever wrong.
 *
 * JDBC rather than JPA: the arithmetic has to happen in the database, not on
 * a stale copy of the row.
 *
 * Each mutation writes a {@link BalanceMutationEvent} to the outbox in the
 * caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveBalanceLedger {

    private static final String COLUMNS =
        "id, employee_id, year, balance_type, total_days, carried_over_days, used_days, pending_days, updated_at";

    private static final String KEY_PREDICATE = "employee_id = ? AND year = ? AND balance_type = ?";

    private static final String REMAINING = "total_days + carried_over_days - used_days - pending_days";

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final LeaveMetrics leaveMetrics;

    /**
     * Opens the yearly account. Fails if it already exists.
     */
    @Transactional
    public LeaveBalance open(BalanceKey key, BigDecimal totalDays, BigDecimal carriedOverDays,
                             UUID actorId, String reason) {
        requireNonNegative(totalDays, "Total days");
        requireNonNegative(carriedOverDays, "Carried-over days");

        LeaveBalance opened;
        try {
            opened = jdbcTemplate.queryForObject(
                "INSERT INTO leave_balances (employee_id, year, balance_type, total_days, carried_over_days) " +
                "VALUES (?, ?, ?, ?, ?) RETURNING " + COLUMNS,
                balanceRowMapper(),
                key.getEmployeeId(), key.getYear(), key.getBalanceType().name(), totalDays, carriedOverDays
            );
        } catch (DuplicateKeyException e) {
            throw new LeaveValidationException(String.format(
                "%s balance for %d already exists", key.getBalanceType(), key.getYear()));
        }

        recordMutation(opened, BalanceMutationType.OPEN, totalDays.add(carriedOverDays),
                BigDecimal.ZERO, reason, actorId, null);
        log.info("Opened {} balance {} for employee {}: total={}, carriedOver={}",
                key.getBalanceType(), key.getYear(), key.getEmployeeId(), totalDays, carriedOverDays);
        return opened;
    }

    /**
     * Moves days from remaining to pending.
     *
     * @throws InsufficientBalanceException if remaining is lower than days; nothing is written.
     *         A missing account counts as a remaining balance of zero.
     */
    @Transactional
    public LeaveBalance reserve(BalanceKey key, BigDecimal days, UUID leaveRequestId) {
        requirePositive(days);

        Optional<LeaveBalance> updated = update(
            "UPDATE leave_balances SET pending_days = pending_days + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE " + KEY_PREDICATE + " AND " + REMAINING + " >= ? RETURNING " + COLUMNS,
            days, key.getEmployeeId(), key.getYear(), key.getBalanceType().name(), days
        );

        if (updated.isEmpty()) {
            BigDecimal remaining = find(key).map(LeaveBalance::remaining).orElse(BigDecimal.ZERO);
            leaveMetrics.recordLedgerMutation(BalanceMutationType.RESERVE.name(), "insufficient");
            throw new InsufficientBalanceException(key, remaining, days);
        }

        LeaveBalance balance = updated.get();
        recordMutation(balance, BalanceMutationType.RESERVE, days, balance.getTotalDays(),
                "Reserved for leave request", null, leaveRequestId);
        log.debug("Reserved {} days on {}: remaining={}", days, key, balance.remaining());
        return balance;
    }

    /**
     * Moves days from pending to used. Called once, when a request is approved.
     */
    @Transactional
    public LeaveBalance commit(BalanceKey key, BigDecimal days, UUID leaveRequestId) {
        requirePositive(days);

        LeaveBalance balance = update(
            "UPDATE leave_balances SET pending_days = pending_days - ?, used_days = used_days + ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE " + KEY_PREDICATE + " AND pending_days >= ? RETURNING " + COLUMNS,
            days, days, key.getEmployeeId(), key.getYear(), key.getBalanceType().name(), days
        ).orElseThrow(() -> pendingUnderflow(key, days, BalanceMutationType.COMMIT));

        recordMutation(balance, BalanceMutationType.COMMIT, days, balance.getTotalDays(),
                "Leave approved", null, leaveRequestId);
        log.debug("Committed {} days on {}", days, key);
        return balance;
    }

    /**
     * Returns pending days to remaining. Called once, when a submitted request
     * is refused, returned or cancelled.
     */
    @Transactional
    public LeaveBalance release(BalanceKey key, BigDecimal days, UUID leaveRequestId) {
        requirePositive(days);

        LeaveBalance balance = update(
            "UPDATE leave_balances SET pending_days = pending_days - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE " + KEY_PREDICATE + " AND pending_days >= ? RETURNING " + COLUMNS,
            days, key.getEmployeeId(), key.getYear(), key.getBalanceType().name(), days
        ).orElseThrow(() -> pendingUnderflow(key, days, BalanceMutationType.RELEASE));

        recordMutation(balance, BalanceMutationType.RELEASE, days.negate(), balance.getTotalDays(),
                "Reservation released", null, leaveRequestId);
        log.debug("Released {} days on {}: remaining={}", days, key, balance.remaining());
        return balance;
    }

    /**
     * Administrative correction of the total entitlement.
     *
     * @throws LeaveValidationException if the reason is blank or delta is zero
     * @throws InsufficientBalanceException if the result would leave a negative total or remaining
     * @throws BalanceNotFoundException if the account does not exist
     */
    @Transactional
    public LeaveBalance adjust(BalanceKey key, BigDecimal delta, String reason, UUID actorId) {
        if (reason == null || reason.isBlank()) {
            throw new LeaveValidationException("A reason is required for every balance adjustment");
        }
        if (delta == null || delta.signum() == 0) {
            throw new LeaveValidationException("Adjustment delta must be non-zero");
        }

        Optional<LeaveBalance> updated = update(
            "UPDATE leave_balances SET total_days = total_days + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE " + KEY_PREDICATE + " AND total_days + ? >= 0 AND " + REMAINING + " + ? >= 0 " +
            "RETURNING " + COLUMNS,
            delta, key.getEmployeeId(), key.getYear(), key.getBalanceType().name(), delta, delta
        );

        if (updated.isEmpty()) {
            LeaveBalance current = find(key).orElseThrow(() -> new BalanceNotFoundException(key));
            leaveMetrics.recordLedgerMutation(BalanceMutationType.ADJUST.name(), "negative");
            throw new InsufficientBalanceException(key, current.remaining(), delta.negate());
        }

        LeaveBalance balance = updated.get();
        recordMutation(balance, BalanceMutationType.ADJUST, delta,
                balance.getTotalDays().subtract(delta), reason.trim(), actorId, null);
        log.info("Adjusted {} by {}: newTotal={}, remaining={}, reason={}",
                key, delta, balance.getTotalDays(), balance.remaining(), reason);
        return balance;
    }

    /**
     * Credits carried-over days to an existing account that has none yet.
     *
     * @throws LeaveValidationException if the account already holds carried-over days
     */
    @Transactional
    public LeaveBalance addCarryOver(BalanceKey key, BigDecimal days, UUID actorId, String reason) {
        requirePositive(days);

        Optional<LeaveBalance> updated = update(
            "UPDATE leave_balances SET carried_over_days = carried_over_days + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE " + KEY_PREDICATE + " AND carried_over_days = 0 RETURNING " + COLUMNS,
            days, key.getEmployeeId(), key.getYear(), key.getBalanceType().name()
        );
        if (updated.isEmpty()) {
            if (find(key).isEmpty()) {
                throw new BalanceNotFoundException(key);
            }
            leaveMetrics.recordLedgerMutation(BalanceMutationType.CARRY_OVER.name(), "already_carried");
            throw new LeaveValidationException(String.format(
                "%s balance for %d already holds carried-over days", key.getBalanceType(), key.getYear()));
        }
        LeaveBalance balance = updated.get();

        recordMutation(balance, BalanceMutationType.CARRY_OVER, days, balance.getTotalDays(),
                reason, actorId, null);
        return balance;
    }

    /**
     * Reads the account and holds its row lock until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LeaveBalance> lock(BalanceKey key) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM leave_balances WHERE " + KEY_PREDICATE + " FOR UPDATE",
            balanceRowMapper(),
            key.getEmployeeId(), key.getYear(), key.getBalanceType().name()
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<LeaveBalance> find(BalanceKey key) {
        List<LeaveBalance> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM leave_balances WHERE " + KEY_PREDICATE,
            balanceRowMapper(),
            key.getEmployeeId(), key.getYear(), key.getBalanceType().name()
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<LeaveBalance> findForEmployee(UUID employeeId, int year) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM leave_balances WHERE employee_id = ? AND year = ? ORDER BY balance_type",
            balanceRowMapper(),
            employeeId, year
        );
    }

    private Optional<LeaveBalance> update(String sql, Object... args) {
        return jdbcTemplate.query(sql, balanceRowMapper(), args).stream().findFirst();
    }

    private void recordMutation(LeaveBalance balance, BalanceMutationType mutation, BigDecimal delta,
                                BigDecimal totalBefore, String reason, UUID actorId, UUID leaveRequestId) {
        BalanceMutationEvent event = BalanceMutationEvent.builder()
            .eventId(UUID.randomUUID())
            .balanceId(balance.getId())
            .employeeId(balance.getEmployeeId())
            .year(balance.getYear())
            .balanceType(balance.getBalanceType())
            .mutation(mutation)
            .delta(delta)
            .reason(reason)
            .actorId(actorId)
            .leaveRequestId(leaveRequestId)
            .totalDaysBefore(totalBefore)
            .totalDaysAfter(balance.getTotalDays())
            .remainingAfter(balance.remaining())
            .occurredAt(Instant.now())
            .build();
        outboxService.saveEvent(event);
        leaveMetrics.recordLedgerMutation(mutation.name(), "success");
    }

    private IllegalStateException pendingUnderflow(BalanceKey key, BigDecimal days, BalanceMutationType mutation) {
        leaveMetrics.recordLedgerMutation(mutation.name(), "underflow");
        // Only reachable if a request is committed or released without a matching reservation
        return new IllegalStateException(String.format(
            "Cannot %s %s days on %s: not enough pending days", mutation.name().toLowerCase(), days, key));
    }

    private static void requirePositive(BigDecimal days) {
        if (days == null || days.signum() <= 0) {
            throw new IllegalArgumentException("Days must be positive: " + days);
        }
    }

    private static void requireNonNegative(BigDecimal value, String label) {
        if (value == null || value.signum() < 0) {
            throw new LeaveValidationException(label + " must be zero or more");
        }
    }

    private RowMapper<LeaveBalance> balanceRowMapper() {
        return (rs, rowNum) -> new LeaveBalance(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("employee_id")),
            rs.getInt("year"),
            BalanceType.valueOf(rs.getString("balance_type")),
            rs.getBigDecimal("total_days"),
            rs.getBigDecimal("carried_over_days"),
            rs.getBigDecimal("used_days"),
            rs.getBigDecimal("pending_days"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
