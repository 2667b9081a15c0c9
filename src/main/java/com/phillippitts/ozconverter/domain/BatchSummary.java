package com.phillippitts.ozconverter.domain;

/**
 * Aggregate counts for the jobs the coordinator has tracked.
 *
 * @param submitted jobs submitted
 * @param succeeded jobs that completed successfully
 * @param failed jobs that completed in failure, cancelled ones included
 * @param cancelled jobs dropped from the queue before starting
 */
public record BatchSummary(int submitted, int succeeded, int failed, int cancelled) {

    public int completed() {
        return succeeded + failed;
    }

    public int pending() {
        return submitted - completed();
    }
}
