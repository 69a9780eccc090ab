package com.flagship.leave_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Runs an event handler at most once per (event id, consumer group).
 *
 * The processed marker is inserted first and shares one transaction with the
 * handler, so two deliveries of the same event racing each other run the
 * handler once. If the handler throws, the marker rolls back with it and the
 * exception reaches the listener, which leaves the offset uncommitted so
 * Kafka redelivers.
 *
 * <pre>
 * eventProcessor.processEvent(eventId, "leave-event-consumer", eventType,
 *     "LeaveRequest", requestId, () -> handler.onTransition(event));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String consumerGroup, String eventType,
                                String aggregateType, UUID aggregateId, Runnable handler) {
        int claimed = repository.claim(eventId, consumerGroup, eventType, aggregateType, aggregateId, Instant.now());
        if (claimed == 0) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}) by consumer group {}: {}",
                    eventId, eventType, consumerGroup, e.getMessage(), e);
            throw e;
        }

        log.debug("Processed event {} ({}) by consumer group {}", eventId, eventType, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer does not handle, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String consumerGroup, String eventType,
                          String aggregateType, UUID aggregateId, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, consumerGroup, eventType, aggregateType, aggregateId, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
