package com.jumpad.mathapi.exception;

/**
 * Thrown when a list is present but cannot be used for the requested operation:
 * an element is not losslessly convertible to an integer, the list is empty where
 * the operation forbids it, or the result leaves the 64-bit range.
 *
 * <p>Results in a 422 Unprocessable Entity response.</p>
 */
public class InputValueException extends InvalidInputException {

    public static final String KIND = "VALUE_ERROR";

    public InputValueException(String message) {
        super(message);
    }

    public InputValueException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
