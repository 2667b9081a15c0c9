package com.phillippitts.ozconverter.service.routine;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.service.events.ErrorLine;
import com.phillippitts.ozconverter.service.events.JobEventSink;
import com.phillippitts.ozconverter.service.events.OutputLine;
import com.phillippitts.ozconverter.service.process.ToolOutputListener;

import java.util.Objects;

/**
 * Per-job information a routine needs besides its input and workspace.
 *
 * @param jobId id used on emitted events
 * @param settings worker-local settings decoded from the job's snapshot
 * @param targetExtension requested primary output extension, without dot (blank when not applicable)
 * @param sink where output and error lines go
 */
public record RoutineContext(long jobId, JobSettings settings, String targetExtension, JobEventSink sink) {

    public RoutineContext {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(sink, "sink");
        targetExtension = targetExtension == null ? "" : targetExtension;
    }

    public void output(String line) {
        sink.emit(new OutputLine(jobId, line));
    }

    public void error(String line) {
        sink.emit(new ErrorLine(jobId, line));
    }

    /**
     * Routes tool stdout to output lines and stderr to error lines.
     */
    public ToolOutputListener toolListener() {
        return new ToolOutputListener() {
            @Override
            public void stdout(String line) {
                output(line);
            }

            @Override
            public void stderr(String line) {
                error(line);
            }
        };
    }

    public String targetExtensionOr(String fallback) {
        return targetExtension.isBlank() ? fallback : targetExtension;
    }
}
