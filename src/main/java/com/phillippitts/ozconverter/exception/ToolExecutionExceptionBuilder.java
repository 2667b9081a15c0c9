package com.phillippitts.ozconverter.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ToolExecutionException} carrying process context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ToolExecutionExceptionBuilder.create("Non-zero exit")
 *         .tool("chdman")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("hint", "Input file may be corrupt")
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (tool: {tool})}.
 */
public final class ToolExecutionExceptionBuilder {

    private final String message;
    private String toolName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ToolExecutionExceptionBuilder(String message) {
        this.message = message;
    }

    public static ToolExecutionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ToolExecutionExceptionBuilder(message);
    }

    public ToolExecutionExceptionBuilder tool(String toolName) {
        this.toolName = toolName;
        return this;
    }

    public ToolExecutionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ToolExecutionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ToolExecutionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     */
    public ToolExecutionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ToolExecutionException build() {
        String detailedMessage = buildDetailedMessage();
        String tool = toolName != null ? toolName : "unknown";
        int code = exitCode != null ? exitCode : -1;

        if (cause != null) {
            return new ToolExecutionException(detailedMessage, tool, code, cause);
        }
        return new ToolExecutionException(detailedMessage, tool, code);
    }

    private String buildDetailedMessage() {
        if (exitCode == null && durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
