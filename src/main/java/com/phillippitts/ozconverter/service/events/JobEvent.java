package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

/**
 * Message from a worker to the coordinator about one job.
 *
 * <p>Events for the same job id are emitted by a single worker thread and arrive in order.
 * No ordering holds across jobs.
 */
public interface JobEvent {

    long jobId();

    EventType type();

    /**
     * Event payload as JSON, without the envelope.
     */
    JSONObject data();

    /**
     * Renders {@code {"job_id": .., "type": .., "data": {..}}}.
     */
    default String toJson() {
        return new JSONObject()
                .put("job_id", jobId())
                .put("type", type().wireName())
                .put("data", data())
                .toString();
    }
}
