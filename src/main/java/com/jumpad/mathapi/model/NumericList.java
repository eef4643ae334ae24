package com.jumpad.mathapi.model;

import java.util.List;

/**
 * An ordered, immutable list of integers that has passed coercion.
 *
 * <p>Instances are only produced by a {@link com.jumpad.mathapi.converter.NumericCoercer},
 * so arithmetic code can rely on every element being an exact 64-bit integer.</p>
 *
 * @param values the coerced values, in input order
 */
public record NumericList(List<Long> values) {

    public NumericList {
        values = List.copyOf(values);
    }

    public static NumericList of(Long... values) {
        return new NumericList(List.of(values));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
