package com.flagship.leave_ledger.balance;

public enum BalanceType {
    ANNUAL,
    OFFERED
}
