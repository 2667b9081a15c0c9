package com.phillippitts.ozconverter.exception;

/**
 * Thrown when a job's settings snapshot cannot be decoded into typed settings.
 */
public class SettingsSnapshotException extends OzConverterException {

    private final String key;

    public SettingsSnapshotException(String key, String value, Throwable cause) {
        super("Invalid setting " + key + "='" + value + "'", cause);
        this.key = key;
    }

    public SettingsSnapshotException(String message) {
        super(message);
        this.key = null;
    }

    /**
     * @return offending key, or null when the snapshot as a whole was unreadable
     */
    public String getKey() {
        return key;
    }
}
