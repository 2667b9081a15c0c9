package com.phillippitts.ozconverter.domain;

/**
 * Coordinator-side lifecycle of a submitted job.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED_SUCCESS,
    COMPLETED_FAILURE;

    public boolean isTerminal() {
        return this == COMPLETED_SUCCESS || this == COMPLETED_FAILURE;
    }
}
