package com.example.tubefetch.exceptions;

/**
 * A download or conversion step failed: the extraction engine or ffmpeg exited abnormally,
 * timed out, or produced nothing usable.
 */
public class PipelineException extends RuntimeException {

    private final Integer exitCode; // null when the process never reported one
    private final String toolOutput; // raw tool output, for logs only

    public PipelineException(String message) {
        super(message);
        this.exitCode = null;
        this.toolOutput = null;
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
        this.toolOutput = null;
    }

    public PipelineException(String message, int exitCode, String toolOutput) {
        super(message);
        this.exitCode = exitCode;
        this.toolOutput = toolOutput;
    }

    /**
     * @return the process exit code, or null if not available.
     */
    public Integer getExitCode() {
        return exitCode;
    }

    /**
     * @return captured tool output, or null if not captured. Never shown to users.
     */
    public String getToolOutput() {
        return toolOutput;
    }
}
