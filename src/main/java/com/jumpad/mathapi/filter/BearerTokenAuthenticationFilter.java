package com.jumpad.mathapi.filter;

import com.jumpad.mathapi.exception.AuthException;
import com.jumpad.mathapi.security.AuthenticatedPrincipal;
import com.jumpad.mathapi.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authorization gate for the compute endpoints.
 *
 * <p>Requests to {@code /somar} and {@code /calcular_media} must carry
 * {@code Authorization: Bearer <token>}. The token is verified by {@link TokenService};
 * on success the resolved {@link AuthenticatedPrincipal} is placed in the Spring
 * Security context and in the {@value #PRINCIPAL_ATTRIBUTE} request attribute.</p>
 *
 * <p>Any failure ends the request with 401 and one generic message. The specific
 * reason is only logged. Other paths pass through untouched.</p>
 *
 * <p>Registered inside the Spring Security filter chain by
 * {@link com.jumpad.mathapi.config.SecurityConfig}, not as a standalone servlet filter.</p>
 */
@Component
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);

    private static final String AUTH_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    public static final String PRINCIPAL_ATTRIBUTE = "authenticatedPrincipal";
    public static final Set<String> PROTECTED_PATHS = Set.of("/somar", "/calcular_media");

    private final TokenService tokenService;
    private final ErrorResponseWriter errorResponseWriter;

    public BearerTokenAuthenticationFilter(TokenService tokenService,
                                           ErrorResponseWriter errorResponseWriter) {
        this.tokenService = tokenService;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !PROTECTED_PATHS.contains(pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        AuthenticatedPrincipal principal;
        try {
            principal = tokenService.verify(extractToken(request));
        } catch (AuthException e) {
            log.warn("Rejected {} {}: {} ({})",
                request.getMethod(), request.getRequestURI(), e.getReason(), e.getMessage());
            SecurityContextHolder.clearContext();
            sendUnauthorizedResponse(response);
            return;
        }

        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
            principal, null, List.of(new SimpleGrantedAuthority(principal.role().authority())));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        MDC.put("subject", principal.subject());
        MDC.put("role", principal.role().claimValue());

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("subject");
            MDC.remove("role");
            SecurityContextHolder.clearContext();
        }
    }

    /**
     * Extracts the bearer token, or returns null when the header is absent or uses
     * another scheme.
     */
    private String extractToken(HttpServletRequest request) {
        String authHeader = request.getHeader(AUTH_HEADER);
        if (authHeader == null
                || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return authHeader.substring(BEARER_PREFIX.length()).trim();
    }

    private void sendUnauthorizedResponse(HttpServletResponse response) throws IOException {
        response.setHeader("WWW-Authenticate", "Bearer");
        errorResponseWriter.write(response, HttpStatus.UNAUTHORIZED, AuthException.KIND, AuthException.CLIENT_MESSAGE);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
