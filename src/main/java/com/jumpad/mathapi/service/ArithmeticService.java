package com.jumpad.mathapi.service;

import com.jumpad.mathapi.converter.NumericCoercer;
import com.jumpad.mathapi.exception.InvalidInputException;
import com.jumpad.mathapi.exception.InputValueException;
import com.jumpad.mathapi.model.NumericList;
import com.jumpad.mathapi.model.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigInteger;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service layer for the sum and mean operations.
 *
 * <p>Both operations run the shared coercion step first, so type and shape errors
 * surface before any arithmetic. They differ only in how they treat an empty list:</p>
 * <ul>
 *   <li><b>Sum</b> rejects it with {@link InputValueException}</li>
 *   <li><b>Mean</b> returns an empty {@link OptionalDouble} (undefined)</li>
 * </ul>
 *
 * <p>Both operations are pure functions of their input and safe to retry.</p>
 *
 * @version 1.0.0
 */
@Service
public class ArithmeticService {

    private static final Logger logger = LoggerFactory.getLogger(ArithmeticService.class);

    static final String REQUESTS_METRIC = "calculation.requests";

    private final NumericCoercer coercer;
    private final MeterRegistry meterRegistry;

    /**
     * Constructs the service with required dependencies.
     *
     * @param coercer       the coercion strategy
     * @param meterRegistry registry for outcome counters
     */
    public ArithmeticService(NumericCoercer coercer, MeterRegistry meterRegistry) {
        this.coercer = coercer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Sums a list of integer-like values.
     *
     * @param raw the raw {@code numeros} value
     * @return the exact sum
     * @throws com.jumpad.mathapi.exception.InputTypeException if {@code raw} is not a list
     * @throws InputValueException if the list is empty, holds a non-integer element,
     *                             or the sum leaves the 64-bit range
     */
    public long sum(Object raw) {
        try {
            NumericList numbers = coercer.coerce(raw, Operation.SUM);
            if (numbers.isEmpty()) {
                throw new InputValueException(
                    "Erro de valor na operação de soma: A lista de números não pode estar vazia.");
            }

            long total = 0;
            for (long value : numbers.values()) {
                total = Math.addExact(total, value);
            }

            logger.debug("Summed {} values: {}", numbers.size(), total);
            record(Operation.SUM, "success");
            return total;
        } catch (ArithmeticException e) {
            record(Operation.SUM, InputValueException.KIND);
            throw new InputValueException(
                "Erro de valor na operação de soma: O resultado excede o intervalo de inteiros de 64 bits.", e);
        } catch (InvalidInputException e) {
            record(Operation.SUM, e.getKind());
            throw e;
        }
    }

    /**
     * Computes the arithmetic mean of a list of integer-like values.
     *
     * <p>The sum is accumulated exactly before the IEEE-754 division, so large
     * inputs cannot overflow.</p>
     *
     * @param raw the raw {@code numeros} value
     * @return the mean, or empty when the list is empty
     * @throws com.jumpad.mathapi.exception.InputTypeException if {@code raw} is not a list
     * @throws InputValueException if the list holds a non-integer element
     */
    public OptionalDouble average(Object raw) {
        try {
            NumericList numbers = coercer.coerce(raw, Operation.AVERAGE);
            if (numbers.isEmpty()) {
                logger.debug("Mean requested for an empty list, result is undefined");
                record(Operation.AVERAGE, "success");
                return OptionalDouble.empty();
            }

            BigInteger total = BigInteger.ZERO;
            for (long value : numbers.values()) {
                total = total.add(BigInteger.valueOf(value));
            }
            double mean = total.doubleValue() / numbers.size();

            logger.debug("Averaged {} values: {}", numbers.size(), mean);
            record(Operation.AVERAGE, "success");
            return OptionalDouble.of(mean);
        } catch (InvalidInputException e) {
            record(Operation.AVERAGE, e.getKind());
            throw e;
        }
    }

    private void record(Operation operation, String outcome) {
        Counter.builder(REQUESTS_METRIC)
            .description("Number of calculation requests by operation and outcome")
            .tag("operation", operation.tag())
            .tag("outcome", outcome.toLowerCase())
            .register(meterRegistry)
            .increment();
    }
}
