package com.echelon.controlplane.infrastructure.web;

import com.echelon.observability.CorrelationContext;
import com.echelon.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID travels:
 *
 * <ol>
 *   <li>HTTP request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → the action router, which reuses it for the request's context
 *   <li>CorrelationContextHolder → SLF4J MDC → structured log output
 *   <li>This filter → HTTP response header
 * </ol>
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept when it is a plain token of at most
 * {@value #MAX_LENGTH} characters; anything else is replaced by a fresh UUID so header values
 * never reach the logs unchecked.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final int MAX_LENGTH = 128;
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._:-]+$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (!isUsable(correlationId)) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, null, null, null, null));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }

    private static boolean isUsable(String correlationId) {
        return correlationId != null
                && !correlationId.isBlank()
                && correlationId.length() <= MAX_LENGTH
                && SAFE_ID.matcher(correlationId).matches();
    }
}
