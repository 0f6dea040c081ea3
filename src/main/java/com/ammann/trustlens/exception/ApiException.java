package com.ammann.trustlens.exception;

/**
 * Base unchecked exception for all application-level errors in the TrustLens API.
 *
 * <p>Subclasses represent specific error categories (parameter validation, unparseable
 * datasets) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
