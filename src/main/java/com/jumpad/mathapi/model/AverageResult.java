package com.jumpad.mathapi.model;

import java.util.OptionalDouble;

/**
 * Response model for {@code POST /calcular_media}.
 *
 * <p>The mean of an empty list is undefined and serialized as {@code null}:</p>
 * <pre>
 * {"media": 2.5}
 * {"media": null}
 * </pre>
 *
 * @param media the arithmetic mean, or {@code null} when undefined
 */
public record AverageResult(Double media) {

    /**
     * Creates a result from the service's optional mean.
     *
     * @param average the mean, empty when the input list was empty
     * @return the response model
     */
    public static AverageResult of(OptionalDouble average) {
        return new AverageResult(average.isPresent() ? average.getAsDouble() : null);
    }
}
