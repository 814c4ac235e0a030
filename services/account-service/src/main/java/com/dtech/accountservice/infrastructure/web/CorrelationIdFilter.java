package com.dtech.accountservice.infrastructure.web;

import com.dtech.observability.CorrelationContext;
import com.dtech.observability.CorrelationContextHolder;
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
 * Propagates {@code X-Correlation-ID} (or creates one) for every request and echoes it on the
 * response. The id reaches every log line through the MDC; the authorization interceptor later adds
 * the caller and vendor ids to the same context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        CorrelationContext context = CorrelationContext.start(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            // the context must not outlive the request
            CorrelationContextHolder.clear();
        }
    }
}
