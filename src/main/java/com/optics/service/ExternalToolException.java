package com.optics.service;

import java.io.IOException;

/**
 * Thrown when an external program (sim_telarray, rx) fails or produces output that
 * cannot be interpreted. Carries the exit status and the captured output.
 */
public class ExternalToolException extends IOException {

    private final String tool;
    private final int exitStatus;
    private final String output;

    public ExternalToolException(String tool, int exitStatus, String output, String message) {
        super(message);
        this.tool = tool;
        this.exitStatus = exitStatus;
        this.output = output;
    }

    public ExternalToolException(String tool, int exitStatus, String output, String message, Throwable cause) {
        super(message, cause);
        this.tool = tool;
        this.exitStatus = exitStatus;
        this.output = output;
    }

    public ExternalToolException(String tool, String message, Throwable cause) {
        super(message, cause);
        this.tool = tool;
        this.exitStatus = -1;
        this.output = "";
    }

    public String getTool() {
        return tool;
    }

    /** Exit status of the process, -1 if it did not terminate normally. */
    public int getExitStatus() {
        return exitStatus;
    }

    public String getOutput() {
        return output;
    }
}
