/* (C)2026 */
package com.ammann.reflectometry.exception;

/**
 * Base unchecked exception for all application-level errors of the reduction service.
 *
 * <p>Subclasses represent specific error categories (invalid configuration, unsupported
 * corrections, unreadable measurement files) and are mapped to appropriate HTTP status
 * codes by {@link GlobalExceptionHandler}.
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
