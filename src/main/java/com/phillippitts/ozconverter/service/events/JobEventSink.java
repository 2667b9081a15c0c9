package com.phillippitts.ozconverter.service.events;

/**
 * Destination for job events. Implementations must be safe for concurrent emitters.
 */
@FunctionalInterface
public interface JobEventSink {

    void emit(JobEvent event);
}
