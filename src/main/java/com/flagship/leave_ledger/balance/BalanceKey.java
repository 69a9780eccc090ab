package com.flagship.leave_ledger.balance;

import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Identity of a balance account: one per employee, year and balance type.
 * Every ledger mutation is atomic with respect to its key.
 */
@Value(staticConstructor = "of")
public class BalanceKey {
    @NonNull UUID employeeId;
    int year;
    @NonNull BalanceType balanceType;
}
