package com.flagship.leave_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for the leave lifecycle.
 *
 * Metrics exposed:
 * - leave.requests.created: intake outcomes by leave type
 * - leave.workflow.transitions: status changes tagged from/to
 * - leave.ledger.mutations: reserve/commit/release/adjust outcomes
 * - leave.authorization.denied: rejected approver actions
 * - leave.side_effects.failed: notification/audit deliveries that failed
 * - leave.reminders.claimed: reminders claimed by the reminder job
 * - leave.latency: command latency by operation
 * - leave.requests.pending: gauge of requests awaiting a decision
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaveMetrics {

    private final MeterRegistry registry;
    private final JdbcTemplate jdbcTemplate;

    private final AtomicLong pendingRequests = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("leave.requests.pending", pendingRequests, AtomicLong::get)
                .description("Leave requests awaiting a manager or HR decision")
                .register(registry);
    }

    public void refreshPendingRequests() {
        try {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM leave_requests WHERE status IN ('PENDING_MANAGER', 'PENDING_HR')",
                Long.class);
            pendingRequests.set(count != null ? count : 0);
        } catch (Exception e) {
            log.warn("Failed to refresh pending request gauge: {}", e.getMessage());
        }
    }

    public void recordRequestCreated(String leaveTypeCode, String outcome) {
        registry.counter("leave.requests.created",
                "leave_type", sanitizeTag(leaveTypeCode),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransition(String fromStatus, String toStatus) {
        registry.counter("leave.workflow.transitions",
                "from", sanitizeTag(fromStatus),
                "to", sanitizeTag(toStatus)
        ).increment();
    }

    public void recordLedgerMutation(String mutation, String result) {
        registry.counter("leave.ledger.mutations",
                "mutation", sanitizeTag(mutation),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordAuthorizationDenied(String action) {
        registry.counter("leave.authorization.denied",
                "action", sanitizeTag(action)
        ).increment();
    }

    public void recordSideEffectFailure(String channel, String eventType) {
        registry.counter("leave.side_effects.failed",
                "channel", sanitizeTag(channel),
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    public void recordReminderClaimed() {
        registry.counter("leave.reminders.claimed").increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("leave.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
