package com.flagship.leave_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marker that a consumer group has handled an event. Its presence is what
 * makes redelivery after a crash or rebalance a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String consumerGroup;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    Instant processedAt;
    Outcome outcome;
    String note;

    public enum Outcome {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent skipped(UUID eventId, String consumerGroup, String eventType,
                                         String aggregateType, UUID aggregateId, String reason) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, aggregateType, aggregateId,
                Instant.now(), Outcome.SKIPPED, reason);
    }
}
