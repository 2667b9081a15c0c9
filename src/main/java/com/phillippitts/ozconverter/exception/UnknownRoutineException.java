package com.phillippitts.ozconverter.exception;

/**
 * Thrown when a job names a conversion routine id that is not registered.
 */
public class UnknownRoutineException extends OzConverterException {

    private final String routineId;

    public UnknownRoutineException(String routineId) {
        super("Unknown conversion routine: " + routineId);
        this.routineId = routineId;
    }

    public String getRoutineId() {
        return routineId;
    }
}
