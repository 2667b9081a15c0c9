package com.phillippitts.ozconverter.service.process;

/**
 * Receives tool output line by line while the tool is running, ANSI codes already removed.
 * Called from the stream reader threads; implementations must be thread-safe.
 */
public interface ToolOutputListener {

    ToolOutputListener NONE = new ToolOutputListener() {
        @Override
        public void stdout(String line) {
        }

        @Override
        public void stderr(String line) {
        }
    };

    void stdout(String line);

    void stderr(String line);
}
