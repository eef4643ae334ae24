package com.jumpad.mathapi.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP filter that attaches a correlation ID to every request.
 *
 * <h2>Correlation ID Flow:</h2>
 * <ol>
 *   <li>Use the incoming X-Correlation-ID header when it is a plain token</li>
 *   <li>Otherwise generate a short random ID</li>
 *   <li>Put it in the MDC for logging</li>
 *   <li>Echo it in the response header</li>
 * </ol>
 *
 * <p>Runs ahead of the Spring Security chain so that authentication failures are
 * logged with the ID as well.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String correlationId = getOrGenerateCorrelationId(request);

        try {
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            response.addHeader(CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Gets the correlation ID from the request header or generates a new one.
     * Header values with characters outside {@code [A-Za-z0-9._-]} are replaced so
     * they cannot forge log lines.
     *
     * @param request the HTTP request
     * @return the correlation ID
     */
    private String getOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId == null || !SAFE_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString().substring(0, 8);
        }

        return correlationId;
    }
}
