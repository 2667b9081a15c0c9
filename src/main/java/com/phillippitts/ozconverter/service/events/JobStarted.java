package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

/**
 * First event of every job, emitted when a worker dequeues it.
 */
public record JobStarted(long jobId, String filename, int totalStages) implements JobEvent {

    @Override
    public EventType type() {
        return EventType.JOB_STARTED;
    }

    @Override
    public JSONObject data() {
        return new JSONObject().put("filename", filename).put("total_stages", totalStages);
    }
}
