package com.phillippitts.ozconverter.domain;

import java.util.Objects;

/**
 * Outcome of one pipeline stage. Expected failures travel as values, not exceptions.
 *
 * @param success whether the stage completed
 * @param category failure category, null on success
 * @param message human-readable failure reason, null on success
 */
public record StageResult(boolean success, FailureCategory category, String message) {

    private static final StageResult OK = new StageResult(true, null, null);

    public StageResult {
        if (!success) {
            Objects.requireNonNull(category, "category");
            message = message == null ? category.name() : message;
        }
    }

    public static StageResult ok() {
        return OK;
    }

    public static StageResult failure(FailureCategory category, String message) {
        return new StageResult(false, category, message);
    }

    public boolean failed() {
        return !success;
    }
}
