package com.phillippitts.ozconverter.exception;

/**
 * Thrown when an external conversion tool cannot be started, times out or exits non-zero.
 * Conversion routines translate it into a failed result plus an error line; it never
 * escapes a job.
 */
public class ToolExecutionException extends OzConverterException {

    private final String toolName;
    private final int exitCode;

    public ToolExecutionException(String message) {
        this(message, "unknown", -1);
    }

    public ToolExecutionException(String message, String toolName, int exitCode) {
        super(message + " (tool: " + toolName + ")");
        this.toolName = toolName;
        this.exitCode = exitCode;
    }

    public ToolExecutionException(String message, String toolName, int exitCode, Throwable cause) {
        super(message + " (tool: " + toolName + ")", cause);
        this.toolName = toolName;
        this.exitCode = exitCode;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * @return process exit code, or -1 when the tool never produced one (start failure, timeout)
     */
    public int getExitCode() {
        return exitCode;
    }
}
