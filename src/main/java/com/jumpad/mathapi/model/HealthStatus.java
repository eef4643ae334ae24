package com.jumpad.mathapi.model;

/**
 * Response model for {@code GET /saude}.
 *
 * @param status always {@code ok} while the service answers
 */
public record HealthStatus(String status) {

    public static final HealthStatus OK = new HealthStatus("ok");
}
