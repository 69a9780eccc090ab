package com.flagship.leave_ledger.exception;

import com.flagship.leave_ledger.workflow.LeaveStatus;
import lombok.Getter;

/**
 * The request or step is not in a state that allows the attempted command
 * (already decided, already terminal, not awaiting any decision).
 */
@Getter
public class InvalidTransitionException extends LeaveValidationException {

    private final LeaveStatus currentStatus;

    public InvalidTransitionException(LeaveStatus currentStatus, String message) {
        super(message);
        this.currentStatus = currentStatus;
    }
}
