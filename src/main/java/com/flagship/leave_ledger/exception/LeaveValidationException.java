package com.flagship.leave_ledger.exception;

/**
 * Malformed input or a rule violated by the caller's request.
 * Always surfaced to the caller, never retried.
 */
public class LeaveValidationException extends RuntimeException {

    public LeaveValidationException(String message) {
        super(message);
    }
}
