package com.jumpad.mathapi.exception;

/**
 * Thrown when the {@code numeros} field is not a list at all.
 *
 * <p>Results in a 400 Bad Request response.</p>
 */
public class InputTypeException extends InvalidInputException {

    public static final String KIND = "TYPE_ERROR";

    public InputTypeException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
