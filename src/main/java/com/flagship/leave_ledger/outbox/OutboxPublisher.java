package com.flagship.leave_ledger.outbox;

import com.flagship.leave_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox events to the leave-events topic.
 *
 * Events are keyed by aggregate id so every transition of one leave request
 * lands on the same partition in commit order. Once a send for an aggregate
 * fails, its later events in the same batch wait for the next poll, so a
 * consumer never sees CANCELLED before the PENDING_MANAGER that preceded it.
 * A failed send bumps the retry counter; at outbox.publisher.max-retries the
 * event is dead-lettered and no longer claimed.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.leave-events:leave-events}")
    private String leaveEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void relayScheduled() {
        try {
            relayBatch();
        } catch (RuntimeException e) {
            log.error("Leave event relay poll failed", e);
        }
    }

    /**
     * Relays one batch now.
     *
     * @return number of events delivered
     */
    public int triggerPublish() {
        return relayBatch();
    }

    private int relayBatch() {
        List<OutboxEvent> batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        if (batch.isEmpty()) {
            return 0;
        }

        Set<UUID> blockedAggregates = new HashSet<>();
        int delivered = 0;
        for (OutboxEvent event : batch) {
            if (blockedAggregates.contains(event.getAggregateId())) {
                continue;
            }
            if (relay(event)) {
                delivered++;
            } else {
                blockedAggregates.add(event.getAggregateId());
            }
        }

        if (delivered < batch.size()) {
            log.info("Relayed {}/{} leave events, {} aggregates held back",
                    delivered, batch.size(), blockedAggregates.size());
        } else {
            log.debug("Relayed {} leave events", delivered);
        }
        return delivered;
    }

    private boolean relay(OutboxEvent event) {
        try {
            RecordMetadata metadata = kafkaTemplate
                    .send(leaveEventsTopic, event.getAggregateId().toString(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordPublish(event.getEventType(), true);
            log.debug("{} {} for {} {} -> partition {} offset {}",
                    event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId(),
                    metadata.partition(), metadata.offset());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while relaying {} {}", event.getEventType(), event.getId());
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            String cause = e instanceof ExecutionException && e.getCause() != null
                    ? e.getCause().getMessage()
                    : e.getMessage();
            int attempts = outboxService.markFailed(event.getId(), cause);
            outboxMetrics.recordPublish(event.getEventType(), false);
            log.error("Could not relay {} {} for {} {} (attempt {}/{}): {}",
                    event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId(),
                    attempts, maxRetries, cause);
            if (attempts >= maxRetries) {
                outboxMetrics.recordDeadLetter(event.getEventType());
                log.warn("Dead-lettered {} {} for {} {}",
                        event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId());
            }
            return false;
        }
    }
}
