package com.flagship.leave_ledger.balance;

public enum BalanceMutationType {
    OPEN,
    RESERVE,
    COMMIT,
    RELEASE,
    ADJUST,
    CARRY_OVER
}
