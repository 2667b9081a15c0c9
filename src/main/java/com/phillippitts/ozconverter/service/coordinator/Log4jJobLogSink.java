package com.phillippitts.ozconverter.service.coordinator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Writes job lines to the dedicated {@code ozconverter.joblog} logger so they can be routed
 * separately from application logs.
 */
@Component
public class Log4jJobLogSink implements JobLogSink {

    static final String LOGGER_NAME = "ozconverter.joblog";

    private static final Logger JOB_LOG = LogManager.getLogger(LOGGER_NAME);

    @Override
    public void output(long jobId, String filename, String line) {
        JOB_LOG.info("[{}#{}] {}", filename, jobId, line);
    }

    @Override
    public void error(long jobId, String filename, String line) {
        JOB_LOG.warn("[{}#{}] {}", filename, jobId, line);
    }
}
