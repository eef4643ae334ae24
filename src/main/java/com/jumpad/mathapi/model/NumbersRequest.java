package com.jumpad.mathapi.model;

/**
 * Request body shared by the sum and mean endpoints.
 *
 * <p>{@code numeros} is deliberately untyped: the payload is bound as whatever
 * JSON value the client sent and only becomes a {@link NumericList} after coercion.</p>
 *
 * <pre>
 * {
 *     "numeros": [1, "2", 3.0]
 * }
 * </pre>
 *
 * @param numeros the raw JSON value of the {@code numeros} field, {@code null} when absent
 */
public record NumbersRequest(Object numeros) {
}
