package com.jumpad.mathapi.config;

import com.jumpad.mathapi.exception.AuthException;
import com.jumpad.mathapi.filter.BearerTokenAuthenticationFilter;
import com.jumpad.mathapi.filter.ErrorResponseWriter;
import com.jumpad.mathapi.security.Role;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Security configuration for the Secure Math API.
 *
 * <h2>Access Rules:</h2>
 * <ul>
 *   <li>POST /somar, POST /calcular_media: administrator or tester credential</li>
 *   <li>POST /token_admin, POST /token_tester, GET /saude: public</li>
 *   <li>/actuator/**: public (operational endpoints)</li>
 *   <li>Anything else falls through to MVC, which answers 404 or 405</li>
 * </ul>
 *
 * <p>Sessions are stateless and CSRF is disabled: every protected request carries its
 * own bearer credential, checked by {@link BearerTokenAuthenticationFilter}.</p>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] COMPUTE_ROLES = Arrays.stream(Role.values())
        .map(Role::name)
        .toArray(String[]::new);

    /**
     * Configures the security filter chain for the application.
     *
     * @param http the HttpSecurity to configure
     * @param bearerTokenFilter the authorization gate
     * @param errorResponseWriter writer for the fallback 401 body
     * @return the configured SecurityFilterChain
     * @throws Exception if configuration fails
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   BearerTokenAuthenticationFilter bearerTokenFilter,
                                                   ErrorResponseWriter errorResponseWriter) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .cors(Customizer.withDefaults())
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST, "/somar", "/calcular_media").hasAnyRole(COMPUTE_ROLES)
                .requestMatchers(HttpMethod.POST, "/token_admin", "/token_tester").permitAll()
                .requestMatchers(HttpMethod.GET, "/saude").permitAll()
                .requestMatchers("/actuator/**").permitAll()
                .anyRequest().permitAll()
            )

            .addFilterBefore(bearerTokenFilter, UsernamePasswordAuthenticationFilter.class)

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(unauthorizedEntryPoint(errorResponseWriter)))

            .headers(headers -> headers
                .contentTypeOptions(Customizer.withDefaults())
                .frameOptions(frame -> frame.deny())
                .contentSecurityPolicy(csp -> csp.policyDirectives("default-src 'none'"))
                .referrerPolicy(referrer ->
                    referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER))
            );

        return http.build();
    }

    /**
     * Keeps the bearer filter out of the plain servlet filter chain; it only runs
     * inside the security chain.
     */
    @Bean
    public FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration(
            BearerTokenAuthenticationFilter filter) {
        FilterRegistrationBean<BearerTokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    /**
     * CORS policy for browser clients, origins from {@code API_CORS_ORIGINS}.
     *
     * @param allowedOrigins comma separated list of allowed origins
     * @return the CORS configuration source picked up by {@code http.cors()}
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource(
            @Value("${app.cors.allowed-origins:http://localhost}") List<String> allowedOrigins) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(allowedOrigins.stream().map(String::trim).toList());
        configuration.setAllowedMethods(List.of("*"));
        configuration.setAllowedHeaders(List.of("*"));
        configuration.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }

    private AuthenticationEntryPoint unauthorizedEntryPoint(ErrorResponseWriter errorResponseWriter) {
        return (request, response, authException) -> {
            response.setHeader("WWW-Authenticate", "Bearer");
            errorResponseWriter.write(response, HttpStatus.UNAUTHORIZED,
                AuthException.KIND, AuthException.CLIENT_MESSAGE);
        };
    }
}
