package com.example.vidstream.exceptions;

/**
 * Failure of the transcode engine for one (source, profile) pair.
 * {@code retryable} separates transient conditions (resource exhaustion, timeouts) from fatal ones
 * (missing or corrupt source, disk full).
 */
public class TranscodeException extends RuntimeException {

    private final boolean retryable;

    public TranscodeException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TranscodeException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
