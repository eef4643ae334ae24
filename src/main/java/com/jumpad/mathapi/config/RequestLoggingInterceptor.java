package com.jumpad.mathapi.config;

import com.jumpad.mathapi.filter.BearerTokenAuthenticationFilter;
import com.jumpad.mathapi.filter.CorrelationIdFilter;
import com.jumpad.mathapi.security.AuthenticatedPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Access log for requests that reach a controller.
 *
 * <p>One line per request with method, path, status, duration and correlation ID.
 * Compute requests also carry the caller's subject and role, read from the
 * principal the authorization gate stored on the request. Requests rejected by a
 * filter (401, 429) never reach MVC and are logged by that filter.</p>
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger("http.access");
    private static final String START_NANOS_ATTR = RequestLoggingInterceptor.class.getName() + ".start";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_NANOS_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_NANOS_ATTR);
        long durationMs = start instanceof Long startNanos
            ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)
            : 0;

        String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
        int status = response.getStatus();

        if (request.getAttribute(BearerTokenAuthenticationFilter.PRINCIPAL_ATTRIBUTE)
                instanceof AuthenticatedPrincipal principal) {
            logAt(status, "method={} path={} status={} duration={}ms subject={} role={} correlationId={}",
                request.getMethod(), request.getRequestURI(), status, durationMs,
                principal.subject(), principal.role().claimValue(), correlationId);
        } else {
            logAt(status, "method={} path={} status={} duration={}ms correlationId={}",
                request.getMethod(), request.getRequestURI(), status, durationMs, correlationId);
        }
    }

    private static void logAt(int status, String format, Object... args) {
        if (status >= 400) {
            log.warn(format, args);
        } else {
            log.info(format, args);
        }
    }
}
