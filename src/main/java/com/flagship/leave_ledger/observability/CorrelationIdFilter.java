package com.flagship.leave_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Tags every API call with a correlation ID and the acting user.
 *
 * An inbound X-Correlation-ID is reused only if it looks like an id; anything
 * else (too long, spaces, line breaks) is replaced so it cannot forge log lines.
 * The X-Actor-Id header goes to the MDC as is when it is a UUID; controllers
 * still validate it themselves.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern UUID_TEXT = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = acceptedOrNew(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        String actor = request.getHeader(ACTOR_HEADER);
        if (actor != null && UUID_TEXT.matcher(actor).matches()) {
            MDC.put(CorrelationContext.ACTOR_ID_MDC_KEY, actor);
        }
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
            CorrelationContext.clearLeaveContext();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACTOR_ID_MDC_KEY);
        }
    }

    static String acceptedOrNew(String inbound) {
        if (inbound != null && SAFE_ID.matcher(inbound).matches()) {
            return inbound;
        }
        return CorrelationContext.generateCorrelationId();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
