package com.flagship.leave_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class OverlapConflictException extends RuntimeException {

    private final UUID conflictingRequestId;

    public OverlapConflictException(UUID conflictingRequestId) {
        super("Requested dates overlap an existing leave request: " + conflictingRequestId);
        this.conflictingRequestId = conflictingRequestId;
    }
}
