package com.jumpad.mathapi.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the access log for the API endpoints.
 *
 * <p>Actuator scrapes and the container's {@code /error} dispatch are left out of
 * the access log.</p>
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private static final String[] UNLOGGED_PATHS = {"/actuator/**", "/error"};

    private final RequestLoggingInterceptor accessLog;

    public WebMvcConfig(RequestLoggingInterceptor accessLog) {
        this.accessLog = accessLog;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessLog).excludePathPatterns(UNLOGGED_PATHS);
    }
}
