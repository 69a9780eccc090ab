package com.flagship.leave_ledger.calendar;

import com.flagship.leave_ledger.exception.LeaveValidationException;

public class InvalidRangeException extends LeaveValidationException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
