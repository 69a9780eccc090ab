package com.flagship.leave_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation ID plus the MDC keys used across the service.
 *
 * The correlation ID comes from the X-Correlation-ID header (or is generated)
 * and shows up on every log line of the request via MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LEAVE_REQUEST_ID_MDC_KEY = "leaveRequestId";
    public static final String EMPLOYEE_ID_MDC_KEY = "employeeId";
    public static final String ACTOR_ID_MDC_KEY = "actorId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the request and employee ids into the MDC for the duration of a command.
     */
    public static void putLeaveContext(UUID leaveRequestId, UUID employeeId) {
        if (leaveRequestId != null) {
            MDC.put(LEAVE_REQUEST_ID_MDC_KEY, leaveRequestId.toString());
        }
        if (employeeId != null) {
            MDC.put(EMPLOYEE_ID_MDC_KEY, employeeId.toString());
        }
    }

    public static void clearLeaveContext() {
        MDC.remove(LEAVE_REQUEST_ID_MDC_KEY);
        MDC.remove(EMPLOYEE_ID_MDC_KEY);
    }
}
