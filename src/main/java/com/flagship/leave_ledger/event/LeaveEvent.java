package com.flagship.leave_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events written to the outbox.
 *
 * All leave events share these common properties:
 * - Event ID for deduplication
 * - Aggregate ID used as the Kafka key
 * - Timestamp of when the event occurred
 */
public interface LeaveEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The leave request or balance account this event is about.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    /**
     * Event type name for routing.
     */
    String getEventType();
}
