package com.jumpad.mathapi.controller;

import com.jumpad.mathapi.model.AverageResult;
import com.jumpad.mathapi.model.NumbersRequest;
import com.jumpad.mathapi.model.SumResult;
import com.jumpad.mathapi.security.AuthenticatedPrincipal;
import com.jumpad.mathapi.service.ArithmeticService;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for the arithmetic endpoints.
 *
 * <ul>
 *   <li>POST /somar - sum of {@code numeros}</li>
 *   <li>POST /calcular_media - arithmetic mean of {@code numeros}</li>
 * </ul>
 *
 * <p>Both endpoints require a bearer credential; by the time a handler runs the
 * caller has been authenticated. Validation errors raised by the service are
 * translated by {@link com.jumpad.mathapi.exception.GlobalExceptionHandler}.</p>
 *
 * <h3>Example:</h3>
 * <pre>
 * Request:  POST /somar {"numeros": [1, "2", 3.0]}
 * Response: {"resultado": 6}
 * </pre>
 */
@RestController
public class CalculationController {

    private static final Logger logger = LoggerFactory.getLogger(CalculationController.class);

    private final ArithmeticService arithmeticService;

    public CalculationController(ArithmeticService arithmeticService) {
        this.arithmeticService = arithmeticService;
    }

    /**
     * Sums a list of integers.
     *
     * @param request   body holding {@code numeros}
     * @param principal the authenticated caller
     * @return the exact sum
     */
    @PostMapping(value = "/somar", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SumResult> sum(@RequestBody NumbersRequest request,
                                         @AuthenticationPrincipal AuthenticatedPrincipal principal) {
        logger.info("Processing sum request from '{}' ({})", principal.subject(), principal.role());

        long result = arithmeticService.sum(request.numeros());

        logger.info("Sum computed successfully: {}", result);
        return ResponseEntity.ok(new SumResult(result));
    }

    /**
     * Computes the arithmetic mean of a list of integers.
     *
     * @param request   body holding {@code numeros}
     * @param principal the authenticated caller
     * @return the mean, {@code null} for an empty list
     */
    @PostMapping(value = "/calcular_media", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AverageResult> average(@RequestBody NumbersRequest request,
                                                 @AuthenticationPrincipal AuthenticatedPrincipal principal) {
        logger.info("Processing mean request from '{}' ({})", principal.subject(), principal.role());

        OptionalDouble result = arithmeticService.average(request.numeros());

        if (result.isPresent()) {
            logger.info("Mean computed successfully: {}", result.getAsDouble());
        } else {
            logger.info("Mean of an empty list requested, returning null");
        }
        return ResponseEntity.ok(AverageResult.of(result));
    }
}
