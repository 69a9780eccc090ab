package com.flagship.leave_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.leave_ledger.event.BalanceMutationEvent;
import com.flagship.leave_ledger.event.LeaveEvent;
import com.flagship.leave_ledger.event.WorkflowTransitionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit_log rows.
 *
 * Each row commits on its own, so a failed audit write cannot poison the
 * consumer transaction that records the event as processed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcAuditRecorder implements AuditRecorder {

    private static final String INSERT_SQL =
        "INSERT INTO audit_log (actor_id, action, entity_type, entity_id, old_value, new_value, created_at) " +
        "VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordTransition(WorkflowTransitionEvent event) {
        Map<String, Object> oldValue = new LinkedHashMap<>();
        oldValue.put("status", event.getOldStatus());

        Map<String, Object> newValue = new LinkedHashMap<>();
        newValue.put("status", event.getNewStatus());
        newValue.put("stepId", event.getStepId());
        newValue.put("comment", event.getComment());

        String action = event.getAction() != null
            ? "STEP_" + event.getAction().name()
            : "LEAVE_" + event.getNewStatus().name();

        insert(event.getActorId(), action, WorkflowTransitionEvent.AGGREGATE_TYPE, event.getRequestId(),
                oldValue, newValue, event);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordBalanceMutation(BalanceMutationEvent event) {
        Map<String, Object> oldValue = new LinkedHashMap<>();
        oldValue.put("totalDays", event.getTotalDaysBefore());

        Map<String, Object> newValue = new LinkedHashMap<>();
        newValue.put("totalDays", event.getTotalDaysAfter());
        newValue.put("delta", event.getDelta());
        newValue.put("remaining", event.getRemainingAfter());
        newValue.put("reason", event.getReason());
        newValue.put("balanceType", event.getBalanceType());
        newValue.put("year", event.getYear());
        newValue.put("targetEmployeeId", event.getEmployeeId());
        newValue.put("leaveRequestId", event.getLeaveRequestId());

        insert(event.getActorId(), "BALANCE_" + event.getMutation().name(), BalanceMutationEvent.AGGREGATE_TYPE,
                event.getBalanceId(), oldValue, newValue, event);
    }

    private void insert(UUID actorId, String action, String entityType, UUID entityId,
                        Map<String, Object> oldValue, Map<String, Object> newValue,
                        LeaveEvent event) {
        jdbcTemplate.update(INSERT_SQL,
            actorId,
            action,
            entityType,
            entityId.toString(),
            toJson(oldValue),
            toJson(newValue),
            Timestamp.from(event.getOccurredAt())
        );
        log.debug("Audit row written: action={}, entity={}/{}, eventId={}",
                action, entityType, entityId, event.getEventId());
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit value: " + e.getMessage(), e);
        }
    }
}
