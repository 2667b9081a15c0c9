package com.phillippitts.ozconverter.service.events;

import com.phillippitts.ozconverter.domain.FailureCategory;
import org.json.JSONObject;

/**
 * Last event of every job.
 *
 * @param jobId job id
 * @param success overall outcome
 * @param failureCategory why the job failed, null on success
 */
public record JobCompleted(long jobId, boolean success, FailureCategory failureCategory) implements JobEvent {

    public static JobCompleted succeeded(long jobId) {
        return new JobCompleted(jobId, true, null);
    }

    public static JobCompleted failed(long jobId, FailureCategory category) {
        return new JobCompleted(jobId, false, category);
    }

    @Override
    public EventType type() {
        return EventType.JOB_COMPLETED;
    }

    @Override
    public JSONObject data() {
        JSONObject data = new JSONObject().put("success", success);
        if (failureCategory != null) {
            data.put("failure_category", failureCategory.name());
        }
        return data;
    }
}
