package com.flagship.leave_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.leave_ledger.event.LeaveEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outbox of leave events.
 *
 * Workflow, ledger and reminder commands append their events here inside
 * their own transaction, so an event exists exactly when its state change
 * committed. {@link OutboxPublisher} relays them afterwards; delivery state is
 * kept in separate short transactions so a slow broker never holds a lock on
 * a leave request or a balance row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LeaveEvent event) {
        return saveEvent(event.getAggregateType(), event.getAggregateId(), event.getEventType(), event);
    }

    /**
     * Appends an event to the caller's transaction. Fails with
     * IllegalTransactionStateException when there is none.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, toJson(eventType, payload));
        repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return event;
    }

    /**
     * Claims the next batch in commit order. Rows stay locked only for this
     * short transaction; SKIP LOCKED keeps concurrent relays off each other's batch.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        if (repository.markPublished(eventId, Instant.now()) == 0) {
            log.debug("Outbox event {} was already relayed or is gone", eventId);
        }
    }

    /**
     * Counts a failed delivery.
     *
     * @return delivery attempts so far, 0 if the event is unknown or already relayed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        if (repository.recordFailure(eventId, errorMessage) == 0) {
            return 0;
        }
        return repository.findRetryCount(eventId).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(String eventType, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + eventType + " payload", e);
        }
    }
}
