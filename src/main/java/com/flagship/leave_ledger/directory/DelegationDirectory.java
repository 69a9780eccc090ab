package com.flagship.leave_ledger.directory;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Temporary hand-over of approval rights from one user to another.
 */
public interface DelegationDirectory {

    /**
     * Whether delegateId may act for approverId on the given date.
     */
    boolean isDelegate(UUID approverId, UUID delegateId, LocalDate on);

    /**
     * Users who delegated their approvals to delegateId on the given date.
     */
    Set<UUID> delegatorsOf(UUID delegateId, LocalDate on);
}
