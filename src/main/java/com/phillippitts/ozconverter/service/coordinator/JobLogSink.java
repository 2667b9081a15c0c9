package com.phillippitts.ozconverter.service.coordinator;

/**
 * Receives the tool output and error lines the coordinator drains from the results channel.
 */
public interface JobLogSink {

    void output(long jobId, String filename, String line);

    void error(long jobId, String filename, String line);
}
