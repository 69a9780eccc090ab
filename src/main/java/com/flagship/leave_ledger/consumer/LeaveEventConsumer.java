package com.flagship.leave_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.leave_ledger.event.ApprovalReminderEvent;
import com.flagship.leave_ledger.event.BalanceMutationEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Reads the leave-events topic and hands each event to {@link LeaveEventHandler}
 * exactly once per consumer group.
 *
 * Offsets are acknowledged manually after processing. A message that cannot
 * be parsed is acknowledged and dropped; a handler failure is rethrown so the
 * message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LeaveEventConsumer {

    static final String CONSUMER_GROUP = "leave-event-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final LeaveEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.leave-events:leave-events}",
        groupId = "${spring.kafka.consumer.group-id:leave-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, aggregateId={}",
                        envelope.eventType(), envelope.eventId(), envelope.aggregateId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case WorkflowTransitionEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onTransition(deserialize(payload, WorkflowTransitionEvent.class)));
            case BalanceMutationEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onBalanceMutation(deserialize(payload, BalanceMutationEvent.class)));
            case ApprovalReminderEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onReminder(deserialize(payload, ApprovalReminderEvent.class)));
            default -> {
                log.debug("Unknown event type {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), CONSUMER_GROUP, envelope.eventType(),
                        envelope.aggregateType(), envelope.aggregateId(), "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(envelope.eventId(), CONSUMER_GROUP, envelope.eventType(),
                envelope.aggregateType(), envelope.aggregateId(), handler);
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                node.get("eventType").asText(),
                node.get("aggregateType").asText(),
                UUID.fromString(node.get("aggregateId").asText())
            );
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    record EventEnvelope(UUID eventId, String eventType, String aggregateType, UUID aggregateId) {}
}
