package com.flagship.leave_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A leave event waiting in (or already relayed from) the outbox table.
 *
 * Written in the same transaction as the state change it describes and
 * relayed to Kafka afterwards, so a rolled-back command never emits anything
 * and a committed one always does.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "LeaveRequest" or "LeaveBalance"
    UUID aggregateId;
    String eventType;          // e.g. "LeaveStatusChanged"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
