package com.flagship.leave_ledger.exception;

import java.util.UUID;

public class LeaveRequestNotFoundException extends RuntimeException {

    public LeaveRequestNotFoundException(UUID requestId) {
        super("Leave request not found: " + requestId);
    }
}
