package com.flagship.leave_ledger.event;

import com.flagship.leave_ledger.balance.BalanceMutationType;
import com.flagship.leave_ledger.balance.BalanceType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Fact: a balance account changed. Consumed by the audit trail.
 */
@Value
@Builder
@Jacksonized
public class BalanceMutationEvent implements LeaveEvent {

    public static final String EVENT_TYPE = "BalanceMutated";
    public static final String AGGREGATE_TYPE = "LeaveBalance";

    UUID eventId;
    UUID balanceId;
    UUID employeeId;
    int year;
    BalanceType balanceType;
    BalanceMutationType mutation;
    BigDecimal delta;
    String reason;
    UUID actorId;
    UUID leaveRequestId;
    BigDecimal totalDaysBefore;
    BigDecimal totalDaysAfter;
    BigDecimal remainingAfter;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return balanceId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
