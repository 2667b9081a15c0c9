package com.phillippitts.ozconverter.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStateTest {

    @Test
    void startsQueuedAndMovesToRunning() {
        JobState state = new JobState(1, "game.cue");

        assertThat(state.getStatus()).isEqualTo(JobStatus.QUEUED);
        state.markRunning();
        assertThat(state.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(state.isTerminal()).isFalse();
    }

    @Test
    void progressNeverGoesBackwards() {
        JobState state = new JobState(1, "game.cue");

        state.recordStage(2, 66.7);
        state.recordStage(1, 33.3);

        assertThat(state.getStagesDone()).isEqualTo(2);
        assertThat(state.getPercentage()).isEqualTo(66.7);
    }

    @Test
    void failureWithoutCategoryIsUnhandled() {
        JobState state = new JobState(1, "game.cue");

        state.complete(false);

        assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_FAILURE);
        assertThat(state.getFailureCategory()).isEqualTo(FailureCategory.UNHANDLED);
    }

    @Test
    void firstRecordedCategoryWins() {
        JobState state = new JobState(1, "game.cue");

        state.recordFailureCategory(FailureCategory.STAGING);
        state.recordFailureCategory(FailureCategory.FINALIZE);
        state.complete(false);

        assertThat(state.getFailureCategory()).isEqualTo(FailureCategory.STAGING);
    }

    @Test
    void terminalStateIgnoresLateStart() {
        JobState state = new JobState(1, "game.cue");
        state.fail(FailureCategory.CANCELLED);

        state.markRunning();

        assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_FAILURE);
        assertThat(state.isTerminal()).isTrue();
    }
}
