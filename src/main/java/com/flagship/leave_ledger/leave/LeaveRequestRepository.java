package com.flagship.leave_ledger.leave;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequestEntity, UUID> {

    /**
     * Loads a request with SELECT ... FOR UPDATE. Workflow commands hold this
     * lock for their whole read-decide-write transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM LeaveRequestEntity r WHERE r.id = :id")
    Optional<LeaveRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<LeaveRequestEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Requests of the employee whose dates intersect [start, end], ignoring
     * cancelled and refused ones.
     */
    @Query("""
        SELECT r FROM LeaveRequestEntity r
        WHERE r.employeeId = :employeeId
          AND r.id <> :excludeId
          AND r.status NOT IN (com.flagship.leave_ledger.workflow.LeaveStatus.CANCELLED,
                               com.flagship.leave_ledger.workflow.LeaveStatus.REFUSED)
          AND r.startDate <= :endDate
          AND r.endDate >= :startDate
        ORDER BY r.startDate ASC
        """)
    List<LeaveRequestEntity> findOverlapping(@Param("employeeId") UUID employeeId,
                                             @Param("startDate") LocalDate startDate,
                                             @Param("endDate") LocalDate endDate,
                                             @Param("excludeId") UUID excludeId);

    List<LeaveRequestEntity> findByEmployeeIdOrderByStartDateDesc(UUID employeeId);
}
