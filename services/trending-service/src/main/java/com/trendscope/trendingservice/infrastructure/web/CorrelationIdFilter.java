package com.trendscope.trendingservice.infrastructure.web;

import com.trendscope.observability.CorrelationContext;
import com.trendscope.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is reused, otherwise a UUID is generated. The ID
 * is placed in {@link CorrelationContextHolder} (and thereby the SLF4J MDC) for the duration of
 * the request, carried into source fetches triggered by the request, and echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CorrelationContext context =
                CorrelationContext.forHttp(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet threads are pooled.
            CorrelationContextHolder.clear();
        }
    }
}
