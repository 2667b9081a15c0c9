package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

/**
 * Per-file progress bar value; follows each {@link StageProgress} with the same percentage.
 */
public record FileProgress(long jobId, double percentage) implements JobEvent {

    @Override
    public EventType type() {
        return EventType.FILE_PROGRESS_UPDATE;
    }

    @Override
    public JSONObject data() {
        return new JSONObject().put("percentage", percentage);
    }
}
