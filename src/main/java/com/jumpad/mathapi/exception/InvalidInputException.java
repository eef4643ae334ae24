package com.jumpad.mathapi.exception;

/**
 * Base exception for client payloads that cannot be turned into a list of integers.
 *
 * <p>Subclasses distinguish a payload of the wrong shape ({@link InputTypeException})
 * from a list whose contents are unusable ({@link InputValueException}). Both are
 * translated into structured error responses by {@link GlobalExceptionHandler}.</p>
 *
 * @version 1.0.0
 */
public abstract class InvalidInputException extends RuntimeException {

    /**
     * Constructs an InvalidInputException with the specified message.
     *
     * @param message the error message describing the validation failure
     */
    protected InvalidInputException(String message) {
        super(message);
    }

    /**
     * Constructs an InvalidInputException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause of the exception
     */
    protected InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the error kind reported to the client in the {@code erro} field.
     *
     * @return the error kind
     */
    public abstract String getKind();
}
