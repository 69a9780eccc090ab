package com.flagship.leave_ledger.observability;

import com.flagship.leave_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relay lag of leave events. Gauges read the last snapshot; only
 * {@link #refresh()} queries the outbox table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @org.springframework.beans.factory.annotation.Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicReference<BacklogSnapshot> latest = new AtomicReference<>(BacklogSnapshot.EMPTY);

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("leave.outbox.backlog", latest, ref -> ref.get().getPending())
                .description("Leave events written but not yet relayed to Kafka")
                .register(meterRegistry);
        Gauge.builder("leave.outbox.oldest_age_seconds", latest, ref -> ref.get().getOldestAgeSeconds())
                .description("Seconds the oldest unrelayed leave event has been waiting")
                .register(meterRegistry);
        Gauge.builder("leave.outbox.dead_letters", latest, ref -> ref.get().getDeadLetters())
                .description("Leave events that will not be retried any more")
                .register(meterRegistry);
    }

    /**
     * Reads the outbox and publishes the result to the gauges. A failed read
     * keeps the previous snapshot.
     */
    public BacklogSnapshot refresh() {
        try {
            long pending = outboxRepository.countUnpublished();
            long oldestAge = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(createdAt -> Math.max(0, Duration.between(createdAt, Instant.now()).getSeconds()))
                    .orElse(0L);
            long deadLetters = outboxRepository.countDeadLetters(maxRetries);

            BacklogSnapshot snapshot = new BacklogSnapshot(pending, oldestAge, deadLetters);
            latest.set(snapshot);
            log.debug("Leave outbox: {}", snapshot);
            return snapshot;
        } catch (RuntimeException e) {
            log.warn("Could not read leave outbox backlog: {}", e.getMessage());
            return latest.get();
        }
    }

    public BacklogSnapshot latest() {
        return latest.get();
    }

    public void recordPublish(String eventType, boolean delivered) {
        meterRegistry.counter("leave.outbox.relayed",
                "event_type", eventType,
                "result", delivered ? "delivered" : "failed"
        ).increment();
    }

    public void recordDeadLetter(String eventType) {
        meterRegistry.counter("leave.outbox.dead_lettered", "event_type", eventType).increment();
    }

    @Value
    public static class BacklogSnapshot {
        static final BacklogSnapshot EMPTY = new BacklogSnapshot(0, 0, 0);

        long pending;
        long oldestAgeSeconds;
        long deadLetters;
    }
}
