package com.jumpad.mathapi.controller;

import com.jumpad.mathapi.model.HealthStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public liveness endpoint. Detailed health lives under {@code /actuator/health}.
 */
@RestController
public class HealthController {

    @GetMapping(value = "/saude", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthStatus health() {
        return HealthStatus.OK;
    }
}
