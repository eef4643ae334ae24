package com.jumpad.mathapi.model;

/**
 * Response model for {@code POST /somar}.
 *
 * <pre>
 * {
 *     "resultado": 6
 * }
 * </pre>
 *
 * @param resultado the exact sum
 */
public record SumResult(long resultado) {
}
