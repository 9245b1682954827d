package com.arkham.orders.infrastructure.web;

import com.arkham.logging.tracing.TracingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Scopes a trace id to every HTTP request.
 *
 * <p>The id comes from {@code X-Trace-ID}, else from the second field of {@code traceparent},
 * else it is generated. It is made current on the request thread, so every wide event and log
 * line produced while handling the request carries it, and it is echoed on the response in both
 * headers. The thread value is cleared when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    private final TracingContext tracing;

    public TraceIdFilter(TracingContext tracing) {
        this.tracing = tracing;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId =
                tracing.extractFromHeaders(headers(request)).orElseGet(TracingContext::newTraceId);
        tracing.set(traceId);
        tracing.propagateToHeaders().forEach(response::setHeader);

        try {
            filterChain.doFilter(request, response);
        } finally {
            tracing.clear();
        }
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return headers;
    }
}
