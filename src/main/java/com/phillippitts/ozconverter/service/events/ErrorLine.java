package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

/**
 * Error or warning text for a job. Does not by itself change the job outcome.
 */
public record ErrorLine(long jobId, String line) implements JobEvent {

    @Override
    public EventType type() {
        return EventType.ERROR_UPDATE;
    }

    @Override
    public JSONObject data() {
        return new JSONObject().put("line", line);
    }
}
