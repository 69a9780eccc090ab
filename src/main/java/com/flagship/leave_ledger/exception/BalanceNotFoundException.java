package com.flagship.leave_ledger.exception;

import com.flagship.leave_ledger.balance.BalanceKey;

public class BalanceNotFoundException extends RuntimeException {

    public BalanceNotFoundException(BalanceKey key) {
        super(String.format("No %s balance for employee %s in %d",
                key.getBalanceType(), key.getEmployeeId(), key.getYear()));
    }
}
