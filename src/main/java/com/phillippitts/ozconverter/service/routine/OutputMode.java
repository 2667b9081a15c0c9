package com.phillippitts.ozconverter.service.routine;

/**
 * What the finalize stage collects from a workspace after a routine succeeds.
 */
public enum OutputMode {
    /** {@code <base>.<primary ext>} in the workspace root, plus optional companion files. */
    SINGLE_FILE,
    /** Every workspace item, moved into {@code <output dir>/<base>/}. */
    FOLDER,
    /** Informational routine; output is the log only. */
    NONE
}
