package com.example.vidstream.exceptions;

/**
 * Custom RuntimeException indicating a failure during FFmpeg process execution
 * or an unexpected result (e.g., non-zero exit code).
 */
public class FfmpegProcessingException extends RuntimeException {

    private final Integer exitCode; // null when the process never produced one (failed to start)
    private final String stderrOutput;

    public FfmpegProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
        this.stderrOutput = null;
    }

    public FfmpegProcessingException(String message, int exitCode, String stderrOutput) {
        super(message);
        this.exitCode = exitCode;
        this.stderrOutput = stderrOutput;
    }

    /**
     * Gets the exit code of the FFmpeg process, if available.
     * @return The exit code as an Integer, or null if not available.
     */
    public Integer getExitCode() {
        return exitCode;
    }

    /**
     * Gets the standard error output captured from the FFmpeg process, if available.
     * @return The stderr output, or null if not captured or not available.
     */
    public String getStderrOutput() {
        return stderrOutput;
    }
}
