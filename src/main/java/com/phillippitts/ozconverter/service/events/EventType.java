package com.phillippitts.ozconverter.service.events;

/**
 * Event kinds on the results channel, with the names used in their JSON rendering.
 */
public enum EventType {
    JOB_STARTED("job_started"),
    STATUS_UPDATE("status_update"),
    FILE_PROGRESS_UPDATE("file_progress_update"),
    OUTPUT_UPDATE("output_update"),
    ERROR_UPDATE("error_update"),
    JOB_COMPLETED("job_completed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
