package com.phillippitts.ozconverter.exception;

/**
 * Thrown when a job's input cannot be prepared for conversion (missing input,
 * archive that cannot be unpacked or contains no usable media).
 */
public class StagingException extends OzConverterException {

    public StagingException(String message) {
        super(message);
    }

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
