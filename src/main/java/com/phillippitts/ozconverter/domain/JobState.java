package com.phillippitts.ozconverter.domain;

import java.util.Objects;

/**
 * Coordinator-owned progress record for one submitted job.
 *
 * <p>Not thread-safe. Only the coordinator mutates it, while holding its own lock,
 * in response to job events or cancellation.
 */
public final class JobState {

    private final long jobId;
    private final String filename;
    private JobStatus status = JobStatus.QUEUED;
    private int stagesDone;
    private double percentage;
    private FailureCategory failureCategory;

    public JobState(long jobId, String filename) {
        this.jobId = jobId;
        this.filename = Objects.requireNonNull(filename, "filename");
    }

    public void markRunning() {
        if (status == JobStatus.QUEUED) {
            status = JobStatus.RUNNING;
        }
    }

    /**
     * Records stage progress. Percentages never go backwards.
     */
    public void recordStage(int current, double percent) {
        stagesDone = Math.max(stagesDone, current);
        percentage = Math.max(percentage, percent);
    }

    public void complete(boolean success) {
        status = success ? JobStatus.COMPLETED_SUCCESS : JobStatus.COMPLETED_FAILURE;
        if (!success && failureCategory == null) {
            failureCategory = FailureCategory.UNHANDLED;
        }
    }

    public void fail(FailureCategory category) {
        failureCategory = category;
        status = JobStatus.COMPLETED_FAILURE;
    }

    public void recordFailureCategory(FailureCategory category) {
        if (failureCategory == null) {
            failureCategory = category;
        }
    }

    public long getJobId() {
        return jobId;
    }

    public String getFilename() {
        return filename;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getStagesDone() {
        return stagesDone;
    }

    public double getPercentage() {
        return percentage;
    }

    public FailureCategory getFailureCategory() {
        return failureCategory;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "JobState{jobId=" + jobId + ", file='" + filename + "', status=" + status
                + ", stages=" + stagesDone + ", pct=" + percentage + '}';
    }
}
