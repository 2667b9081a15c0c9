package com.phillippitts.ozconverter.exception;

/**
 * Base exception for all ozConverter application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class OzConverterException extends RuntimeException {

    public OzConverterException(String message) {
        super(message);
    }

    public OzConverterException(String message, Throwable cause) {
        super(message, cause);
    }

    public OzConverterException(Throwable cause) {
        super(cause);
    }
}
