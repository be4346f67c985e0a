package de.bycsitsm.dispatch.fieldservice;

/**
 * Exception thrown when a request to the field-service platform fails.
 */
public class FieldServiceException extends RuntimeException {

    public FieldServiceException(String message) {
        super(message);
    }

    public FieldServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
