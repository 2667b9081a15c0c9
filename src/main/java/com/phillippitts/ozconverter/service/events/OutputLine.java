package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

public record OutputLine(long jobId, String line) implements JobEvent {

    @Override
    public EventType type() {
        return EventType.OUTPUT_UPDATE;
    }

    @Override
    public JSONObject data() {
        return new JSONObject().put("line", line);
    }
}
