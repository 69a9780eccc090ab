package com.flagship.leave_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a balance account.
 *
 * remaining = total + carriedOver - used - pending, and never goes below zero.
 */
@Value
public class LeaveBalance {
    UUID id;
    UUID employeeId;
    int year;
    BalanceType balanceType;
    BigDecimal totalDays;
    BigDecimal carriedOverDays;
    BigDecimal usedDays;
    BigDecimal pendingDays;
    Instant updatedAt;

    public BigDecimal remaining() {
        return totalDays.add(carriedOverDays).subtract(usedDays).subtract(pendingDays);
    }

    public BalanceKey key() {
        return BalanceKey.of(employeeId, year, balanceType);
    }
}
