package com.kpisentinel.analyzer.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a trace id to each request. An explicit {@value #TRACE_HEADER} wins, then the trace-id part of a
 * W3C {@code traceparent}. Missing, oversized or malformed ids are replaced by a fresh UUID.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String TRACEPARENT_HEADER = "traceparent";

    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern TRACEPARENT = Pattern.compile("[0-9a-f]{2}-([0-9a-f]{32})-[0-9a-f]{16}-[0-9a-f]{2}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, request.getMethod() + " " + request.getRequestURI()));
        MDC.put("trace_id", traceId);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("trace_id");
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(HttpServletRequest request) {
        String explicit = request.getHeader(TRACE_HEADER);
        if (explicit != null && SAFE_TRACE_ID.matcher(explicit.trim()).matches()) {
            return explicit.trim();
        }
        String traceparent = request.getHeader(TRACEPARENT_HEADER);
        if (traceparent != null) {
            Matcher matcher = TRACEPARENT.matcher(traceparent.trim());
            if (matcher.matches() && !matcher.group(1).chars().allMatch(c -> c == '0')) {
                return matcher.group(1);
            }
        }
        return UUID.randomUUID().toString();
    }
}
