package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.exception.LeaveRequestNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link LeaveRequest} domain object and {@link LeaveRequestEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveRequestPersistenceService {

    private final LeaveRequestRepository repository;

    @Transactional
    public LeaveRequest save(LeaveRequest request, String idempotencyKey) {
        LeaveRequestEntity saved = repository.saveAndFlush(LeaveRequestEntity.fromDomain(request, idempotencyKey));
        log.debug("Saved leave request {} (idempotencyKey={})", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<LeaveRequest> findById(UUID id) {
        return repository.findById(id).map(LeaveRequestEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public LeaveRequest getById(UUID id) {
        return findById(id).orElseThrow(() -> new LeaveRequestNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(LeaveRequestEntity::getId);
    }

    /**
     * Loads the request with a row lock held until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LeaveRequest lockForUpdate(UUID id) {
        return repository.findByIdForUpdate(id)
            .map(LeaveRequestEntity::toDomain)
            .orElseThrow(() -> new LeaveRequestNotFoundException(id));
    }

    /**
     * Writes the new state through the entity's controlled update method.
     * The version check fails the transaction if another writer got there first.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LeaveRequest update(LeaveRequest request) {
        LeaveRequestEntity existing = repository.findById(request.getId())
            .orElseThrow(() -> new LeaveRequestNotFoundException(request.getId()));
        existing.updateFromDomain(request);
        return repository.saveAndFlush(existing).toDomain();
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> findOverlapping(UUID employeeId, LocalDate start, LocalDate end, UUID excludeId) {
        return repository.findOverlapping(employeeId, start, end, excludeId)
            .stream()
            .map(LeaveRequestEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> findByEmployee(UUID employeeId) {
        return repository.findByEmployeeIdOrderByStartDateDesc(employeeId)
            .stream()
            .map(LeaveRequestEntity::toDomain)
            .toList();
    }
}
