package com.phillippitts.ozconverter.service.events;

import org.json.JSONObject;

/**
 * One completed (or synthesized) pipeline stage.
 *
 * @param jobId job id
 * @param description stage label such as "Staged" or "Failed"
 * @param current stages done so far, 1-based
 * @param total stage count per job
 */
public record StageProgress(long jobId, String description, int current, int total) implements JobEvent {

    public StageProgress {
        if (total <= 0 || current < 0 || current > total) {
            throw new IllegalArgumentException("stage " + current + " of " + total);
        }
    }

    public double percentage() {
        return current * 100.0 / total;
    }

    @Override
    public EventType type() {
        return EventType.STATUS_UPDATE;
    }

    @Override
    public JSONObject data() {
        return new JSONObject()
                .put("description", description)
                .put("current", current)
                .put("total", total)
                .put("percentage", percentage());
    }
}
