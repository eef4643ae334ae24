package com.jumpad.mathapi.exception;

import com.jumpad.mathapi.filter.CorrelationIdFilter;
import com.jumpad.mathapi.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the Secure Math API.
 *
 * <p>Every error leaves the service as a JSON {@link ErrorResponse}
 * ({@code {"erro": ..., "detalhes": ...}}) with a matching status:</p>
 *
 * <ul>
 *   <li>{@link InputTypeException}: 400</li>
 *   <li>{@link InputValueException}: 422</li>
 *   <li>{@link AuthException}: 401 with a generic message</li>
 *   <li>Unreadable body: 400, unsupported media type: 415, wrong method: 405, unknown path: 404</li>
 *   <li>Anything else: 500 with a generic message and the correlation ID</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    static final String UNSUPPORTED_MEDIA_TYPE = "UNSUPPORTED_MEDIA_TYPE";
    static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * Handles payloads whose {@code numeros} field is not a list.
     *
     * @param ex the InputTypeException
     * @return 400 with the validation message
     */
    @ExceptionHandler(InputTypeException.class)
    public ResponseEntity<ErrorResponse> handleInputTypeException(InputTypeException ex) {
        logger.warn("Invalid input type: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getKind(), ex.getMessage());
    }

    /**
     * Handles lists that cannot be coerced or used by the operation.
     *
     * @param ex the InputValueException
     * @return 422 with the validation message
     */
    @ExceptionHandler(InputValueException.class)
    public ResponseEntity<ErrorResponse> handleInputValueException(InputValueException ex) {
        logger.warn("Invalid input value: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getKind(), ex.getMessage());
    }

    /**
     * Handles authentication failures raised inside the MVC layer.
     *
     * <p>The reason is logged but never returned.</p>
     *
     * @param ex the AuthException
     * @return 401 with the generic message
     */
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuthException(AuthException ex) {
        logger.warn("Authentication failed: {} ({})", ex.getReason(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(AuthException.KIND, AuthException.CLIENT_MESSAGE));
    }

    /**
     * Handles missing or non-JSON request bodies.
     *
     * @param ex the HttpMessageNotReadableException
     * @return 400
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_REQUEST,
            "Request body must be a JSON object such as {\"numeros\": [1, 2, 3]}.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        logger.warn("Unsupported content type: {}", ex.getContentType());
        return buildErrorResponse(HttpStatus.UNSUPPORTED_MEDIA_TYPE, UNSUPPORTED_MEDIA_TYPE,
            "Content type '" + ex.getContentType() + "' is not supported. Use application/json.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        logger.warn("Method not allowed: {}", ex.getMethod());
        return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, METHOD_NOT_ALLOWED,
            "Method " + ex.getMethod() + " is not supported for this endpoint.");
    }

    /**
     * Handles requests for non-existent resources (404).
     *
     * @param ex the NoResourceFoundException
     * @return 404 with the requested path
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        logger.warn("Resource not found: {}", ex.getResourcePath());
        return buildErrorResponse(HttpStatus.NOT_FOUND, NOT_FOUND,
            "Resource not found: " + ex.getResourcePath());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     *
     * <p>Never exposes internal details; includes the correlation ID so the
     * failure can be found in the logs.</p>
     *
     * @param ex the Exception
     * @return 500 with a generic message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
        logger.error("Unexpected error occurred [correlationId={}]", correlationId, ex);

        String message = "An unexpected error occurred. Please try again later.";
        if (correlationId != null) {
            message += " (Reference: " + correlationId + ")";
        }

        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, message);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String kind, String message) {
        return ResponseEntity
            .status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(kind, message));
    }
}
