package com.flagship.leave_ledger.observability;

import com.flagship.leave_ledger.observability.OutboxMetrics.BacklogSnapshot;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator health contributions of the leave ledger.
 */
public class HealthIndicators {

    /**
     * Leave events that wait too long mean approvers and auditors lag behind
     * the workflow. A large or old backlog is a WARNING; only a backlog past
     * the critical size takes the instance DOWN.
     */
    @Component("leaveOutboxHealth")
    public static class LeaveOutboxHealthIndicator implements HealthIndicator {

        private final OutboxMetrics outboxMetrics;
        private final long backlogWarning;
        private final long backlogCritical;
        private final long maxAgeSeconds;

        public LeaveOutboxHealthIndicator(OutboxMetrics outboxMetrics,
                                          @Value("${outbox.health.backlog-warning:500}") long backlogWarning,
                                          @Value("${outbox.health.backlog-critical:5000}") long backlogCritical,
                                          @Value("${outbox.health.max-age-seconds:300}") long maxAgeSeconds) {
            this.outboxMetrics = outboxMetrics;
            this.backlogWarning = backlogWarning;
            this.backlogCritical = backlogCritical;
            this.maxAgeSeconds = maxAgeSeconds;
        }

        @Override
        public Health health() {
            BacklogSnapshot snapshot = outboxMetrics.refresh();

            Health.Builder builder;
            if (snapshot.getPending() >= backlogCritical) {
                builder = Health.down();
            } else if (snapshot.getPending() >= backlogWarning
                    || snapshot.getOldestAgeSeconds() > maxAgeSeconds
                    || snapshot.getDeadLetters() > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", snapshot.getPending())
                    .withDetail("oldestAgeSeconds", snapshot.getOldestAgeSeconds())
                    .withDetail("deadLetters", snapshot.getDeadLetters())
                    .withDetail("backlogWarning", backlogWarning)
                    .withDetail("backlogCritical", backlogCritical)
                    .build();
        }
    }

    /**
     * Redis only caches idempotency keys of leave intake. When it is
     * unreachable, lookups go to leave_requests.idempotency_key and the
     * service keeps working, so the status is DEGRADED rather than DOWN.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public IdempotencyCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
                if ("PONG".equals(reply)) {
                    return Health.up().withDetail("mode", "redis").build();
                }
                return degraded("unexpected ping reply " + reply);
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String reason) {
            return Health.status("DEGRADED")
                    .withDetail("mode", "database")
                    .withDetail("reason", reason)
                    .build();
        }
    }

    /**
     * The producer connects lazily on the first relayed event, so a producer
     * without connections is UNKNOWN, not DOWN.
     */
    @Component("leaveEventsProducerHealth")
    public static class LeaveEventsProducerHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public LeaveEventsProducerHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                Map<MetricName, ? extends Metric> metrics = kafkaTemplate.metrics();
                double connections = metrics.entrySet().stream()
                        .filter(entry -> "connection-count".equals(entry.getKey().name())
                                && "producer-metrics".equals(entry.getKey().group()))
                        .map(entry -> entry.getValue().metricValue())
                        .filter(Number.class::isInstance)
                        .mapToDouble(value -> ((Number) value).doubleValue())
                        .sum();
                Health.Builder builder = connections > 0 ? Health.up() : Health.unknown();
                return builder.withDetail("connections", (long) connections).build();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
