package com.flagship.credit_ledger.observability;

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

/**
 * Reads X-Correlation-ID from the request (or generates one), exposes it to logging
 * and returns it on the response. Runs before every other filter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String correlationId = CorrelationContext.setCorrelationId(
                request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));

            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
