package com.phillippitts.ozconverter.service.planning;

import com.phillippitts.ozconverter.domain.JobRequest;

import java.nio.file.Path;
import java.util.List;

/**
 * Planner output: either validated requests or an error explaining why there are none.
 *
 * @param requests one request per accepted input
 * @param skipped inputs dropped because their type does not match the selection
 * @param error selection error, null when the selection is valid
 */
public record JobPlan(List<JobRequest> requests, List<Path> skipped, String error) {

    public JobPlan {
        requests = List.copyOf(requests);
        skipped = List.copyOf(skipped);
    }

    static JobPlan error(String message) {
        return new JobPlan(List.of(), List.of(), message);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }
}
