package com.example.vidstream.exceptions;

/**
 * The requested queue or catalog operation collides with the current state of a (video, profile) key:
 * a running job blocks an overwrite, a ready rendition blocks a plain re-enqueue, or a job is no longer cancellable.
 */
public class JobConflictException extends RuntimeException {

    private final Long jobId;

    public JobConflictException(String message) {
        this(message, null);
    }

    public JobConflictException(String message, Long jobId) {
        super(message);
        this.jobId = jobId;
    }

    /**
     * The job that caused the conflict, if there is one.
     */
    public Long getJobId() {
        return jobId;
    }
}
