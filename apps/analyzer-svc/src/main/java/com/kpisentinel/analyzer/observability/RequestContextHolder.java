package com.kpisentinel.analyzer.observability;

import java.util.Optional;

public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static String currentEndpoint() {
        return get().map(RequestContext::endpoint).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** {@code endpoint} is the HTTP method and path, e.g. {@code POST /sessions/s1/analysis}. */
    public record RequestContext(String traceId, String endpoint) {
    }
}
