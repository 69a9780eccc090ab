package com.flagship.leave_ledger.leave;

import lombok.Value;

/**
 * Outcome of leave intake. A replayed result is the request an earlier call
 * with the same idempotency key created.
 */
@Value
public class IntakeResult {
    LeaveRequest request;
    boolean replayed;

    public static IntakeResult created(LeaveRequest request) {
        return new IntakeResult(request, false);
    }

    public static IntakeResult replayed(LeaveRequest request) {
        return new IntakeResult(request, true);
    }
}
