package com.slb.rewards_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Ensures every request and response carries an {@code X-Trace-Id} for correlation.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    private static final int MAX_SUPPLIED_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String supplied = request.getHeader(TraceIdHolder.TRACE_ID_HEADER);
        String traceId = isUsable(supplied) ? supplied.trim() : TraceIdHolder.newTraceId();

        TraceIdHolder.set(traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceIdHolder.clear();
        }
    }

    private boolean isUsable(String supplied) {
        return StringUtils.hasText(supplied) && supplied.trim().length() <= MAX_SUPPLIED_LENGTH;
    }
}
