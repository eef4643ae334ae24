package com.jumpad.mathapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Secure Math API.
 *
 * <p>This service exposes sum and arithmetic mean over lists of integers behind
 * bearer-token authentication, plus a public health check.</p>
 *
 * <h2>API Endpoints:</h2>
 * <ul>
 *   <li>POST /somar - Sum of a list of integers (authenticated)</li>
 *   <li>POST /calcular_media - Arithmetic mean of a list of integers (authenticated)</li>
 *   <li>POST /token_admin, POST /token_tester - Credential issuance</li>
 *   <li>GET /saude - Health check</li>
 * </ul>
 *
 * @version 1.0.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MathApiApplication {

    /**
     * Application entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(MathApiApplication.class, args);
    }
}
