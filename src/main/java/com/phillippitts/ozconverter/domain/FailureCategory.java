package com.phillippitts.ozconverter.domain;

/**
 * Why a job ended in failure. Every category is recovered inside the worker and
 * surfaces only through job events and coordinator counters.
 */
public enum FailureCategory {
    /** Settings could not be decoded, routine unknown, or the workspace could not be created. */
    SETUP,
    /** Input could not be copied or extracted into the workspace. */
    STAGING,
    /** The conversion routine reported failure or its expected output is missing. */
    CONVERSION,
    /** Output could not be moved to the destination. */
    FINALIZE,
    /** Unexpected exception caught at the pipeline or worker boundary. */
    UNHANDLED,
    /** Dropped from the queue before any worker picked it up. */
    CANCELLED
}
