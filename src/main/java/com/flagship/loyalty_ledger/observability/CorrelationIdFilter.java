package com.flagship.loyalty_ledger.observability;

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
 * Binds a correlation id to every API request.
 *
 * The id is taken from X-Correlation-ID when the caller sent a well-formed one
 * and generated otherwise. It is echoed on the response and included in error
 * bodies, so a scanner app can quote it when a scan is rejected.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = CorrelationContext.acceptOrGenerate(
            request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try (MDC.MDCCloseable ignored = MDC.putCloseable(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId)) {
            filterChain.doFilter(request, response);
        } finally {
            // SSE handlers and async dispatch may have bound subject keys on this thread
            MDC.remove(CorrelationContext.CARD_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ENROLLMENT_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator") || uri.equals("/health");
    }
}
