package com.jumpad.mathapi.converter;

import com.jumpad.mathapi.exception.InputTypeException;
import com.jumpad.mathapi.exception.InputValueException;
import com.jumpad.mathapi.model.NumericList;
import com.jumpad.mathapi.model.Operation;

/**
 * Turns an arbitrary client-supplied value into a list of exact integers.
 *
 * <p>The raw value is whatever Jackson bound for the {@code numeros} field: a
 * {@code List}, {@code Map}, {@code String}, {@code Number}, {@code Boolean} or
 * {@code null}. Implementations never mutate the input.</p>
 *
 * <h2>Element rules, applied in order:</h2>
 * <ol>
 *   <li>Integer values are accepted as-is.</li>
 *   <li>Floating-point values are accepted only when finite with a zero fractional part.</li>
 *   <li>Strings are accepted only when made of an optional sign followed by digits.</li>
 *   <li>Anything else (null, boolean, object, nested list) is rejected.</li>
 * </ol>
 * <p>Every accepted value must fit in a signed 64-bit integer.</p>
 *
 * <p>Empty lists are returned as empty; whether an empty list is acceptable is
 * decided by the operation, not by coercion.</p>
 *
 * @version 1.0.0
 */
public interface NumericCoercer {

    /**
     * Coerces a raw payload into a {@link NumericList}.
     *
     * <h3>Examples:</h3>
     * <pre>
     * coerce([1, "2", 3.0])  → [1, 2, 3]
     * coerce([1, "a"])       → InputValueException
     * coerce([1, 2.5])       → InputValueException
     * coerce("not a list")   → InputTypeException
     * </pre>
     *
     * @param raw       the raw value of the {@code numeros} field
     * @param operation the operation the list is destined for, used in error messages
     * @return a new immutable list of integers, in input order
     * @throws InputTypeException  if {@code raw} is not a list
     * @throws InputValueException if an element cannot be converted without loss
     */
    NumericList coerce(Object raw, Operation operation);
}
