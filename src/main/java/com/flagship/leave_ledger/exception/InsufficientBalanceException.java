package com.flagship.leave_ledger.exception;

import com.flagship.leave_ledger.balance.BalanceKey;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when a reservation or adjustment would take a balance below zero.
 * Carries the remaining amount so callers can explain the shortfall.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final BalanceKey key;
    private final BigDecimal remaining;
    private final BigDecimal requested;

    public InsufficientBalanceException(BalanceKey key, BigDecimal remaining, BigDecimal requested) {
        super(String.format("Insufficient %s balance for %d: remaining=%s, requested=%s",
                key.getBalanceType(), key.getYear(), remaining, requested));
        this.key = key;
        this.remaining = remaining;
        this.requested = requested;
    }
}
