package com.flagship.leave_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The actor is not allowed to perform the attempted action on the request.
 */
@Getter
public class ApprovalAuthorizationException extends RuntimeException {

    private final UUID actorId;
    private final UUID requestId;

    public ApprovalAuthorizationException(UUID actorId, UUID requestId, String message) {
        super(message);
        this.actorId = actorId;
        this.requestId = requestId;
    }
}
